package params;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Location of a value inside a params document, e.g. {@code ROW_NAMES.TOTAL_ROW},
 * {@code SECTIONS[1].TITLE} or {@code LABELS["en"]}.
 *
 * <p> Immutable; appending shares the parent path.
 */
public final class FieldPath {

    private static final FieldPath ROOT = new FieldPath(null, null);

    private final @Nullable FieldPath parent;
    private final @Nullable Segment segment;
    private final int depth;

    private FieldPath(@Nullable FieldPath parent, @Nullable Segment segment) {
        this.parent = parent;
        this.segment = segment;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public static FieldPath root() {
        return ROOT;
    }

    /**
     * Build a path of field names, mostly useful in tests: {@code FieldPath.of("ROW_NAMES", "TOTAL_ROW")}.
     */
    public static FieldPath of(String... fieldNames) {
        var path = ROOT;
        for (var name : fieldNames) path = path.field(name);
        return path;
    }

    public FieldPath field(String name) {
        return new FieldPath(this, new Segment.Field(name));
    }

    public FieldPath index(int index) {
        return new FieldPath(this, new Segment.Index(index));
    }

    public FieldPath key(String key) {
        return new FieldPath(this, new Segment.Key(key));
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * @return number of segments
     */
    public int depth() {
        return depth;
    }

    public List<Segment> segments() {
        var segments = new ArrayDeque<Segment>(depth);
        for (var p = this; p.segment != null; p = p.parent) segments.addFirst(p.segment);
        return List.copyOf(segments);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldPath p && depth == p.depth && Objects.equals(segments(), p.segments());
    }

    @Override
    public int hashCode() {
        return segments().hashCode();
    }

    @Override
    public String toString() {
        if (isRoot()) return "<root>";
        var sb = new StringBuilder();
        for (var s : segments()) {
            if (s instanceof Segment.Field f) {
                if (sb.length() > 0) sb.append('.');
                sb.append(f.name());
            } else if (s instanceof Segment.Index i) {
                sb.append('[').append(i.index()).append(']');
            } else if (s instanceof Segment.Key k) {
                sb.append('[');
                JsonReader.escapeTo(sb.append('"'), k.key());
                sb.append("\"]");
            }
        }
        return sb.toString();
    }

    public sealed interface Segment {
        record Field(String name) implements Segment {}

        record Index(int index) implements Segment {}

        record Key(String key) implements Segment {}
    }
}
