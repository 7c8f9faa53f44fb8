package params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Errors collected during one build, in discovery order.
 *
 * <p> Empty means the build succeeded.
 */
public final class ErrorReport {

    private final List<ValidationError> errors = new ArrayList<>();

    ErrorReport() {}

    static ErrorReport of(ValidationError error) {
        var report = new ErrorReport();
        report.add(error);
        return report;
    }

    void add(ValidationError error) {
        errors.add(error);
    }

    void addAll(ErrorReport other) {
        errors.addAll(other.errors);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public List<ValidationError> errors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * @return distinct error paths, in discovery order
     */
    public Set<FieldPath> paths() {
        var paths = new LinkedHashSet<FieldPath>();
        for (var e : errors) paths.add(e.path());
        return Collections.unmodifiableSet(paths);
    }

    public List<ValidationError> errorsAt(FieldPath path) {
        var found = new ArrayList<ValidationError>();
        for (var e : errors) if (e.path().equals(path)) found.add(e);
        return found;
    }

    /**
     * Render the whole report, one error per line.
     *
     * @param subject name of what was being built, usually the schema name
     */
    public String render(String subject) {
        var sb = new StringBuilder()
                .append(errors.size())
                .append(errors.size() == 1 ? " validation error" : " validation errors")
                .append(" building ")
                .append(subject)
                .append(':');
        for (var e : errors) sb.append('\n').append("  ").append(e.render());
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ErrorReport" + errors;
    }
}
