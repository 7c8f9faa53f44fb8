package params;

import org.jspecify.annotations.Nullable;

/**
 * One problem found while building params, attributed to the path where it was found.
 *
 * @param path     location in the params document
 * @param code     kind of problem
 * @param expected descriptor the value was matched against, {@code null} for undeclared members
 * @param actual   offending raw value, {@code null} when the value is absent
 * @param message  human readable description
 */
public record ValidationError(
        FieldPath path, Code code, @Nullable TypeDescriptor expected, @Nullable JsonValue actual, String message) {

    private static final int MAX_VALUE_LENGTH = 60;

    public enum Code {
        MISSING_FIELD,
        TYPE_MISMATCH,
        UNKNOWN_FIELD,
        NO_UNION_MATCH,
        DEPTH_EXCEEDED,
        REJECTED
    }

    static ValidationError missingField(FieldPath path, TypeDescriptor expected) {
        return new ValidationError(path, Code.MISSING_FIELD, expected, null, "required field is missing");
    }

    static ValidationError typeMismatch(FieldPath path, TypeDescriptor expected, @Nullable JsonValue actual) {
        return typeMismatch(path, expected, actual, "expected " + article(expected) + " but got " + JsonValue.typeNameOf(actual));
    }

    static ValidationError typeMismatch(
            FieldPath path, TypeDescriptor expected, @Nullable JsonValue actual, String message) {
        return new ValidationError(path, Code.TYPE_MISMATCH, expected, actual, message);
    }

    static ValidationError unknownField(FieldPath path, JsonValue actual) {
        return new ValidationError(
                path, Code.UNKNOWN_FIELD, null, actual, "field is not declared by the schema, check its spelling");
    }

    static ValidationError noUnionMatch(FieldPath path, TypeDescriptor.Union expected, @Nullable JsonValue actual) {
        return new ValidationError(
                path,
                Code.NO_UNION_MATCH,
                expected,
                actual,
                "value matches none of " + expected.alternatives().size() + " alternatives");
    }

    static ValidationError depthExceeded(
            FieldPath path, @Nullable TypeDescriptor expected, @Nullable JsonValue actual, int maxDepth) {
        return new ValidationError(
                path, Code.DEPTH_EXCEEDED, expected, actual, "maximum nesting depth of " + maxDepth + " exceeded");
    }

    static ValidationError rejected(FieldPath path, Schema<?> schema, JsonValue actual, String reason) {
        return new ValidationError(
                path,
                Code.REJECTED,
                TypeDescriptor.nested(schema),
                actual,
                schema.type().getSimpleName() + " rejected the values: " + (reason == null ? "no reason given" : reason));
    }

    /**
     * Render as one report line: {@code ROW_NAMES.TOTAL_ROW: expected a string but got number (expected string, got number 7)}.
     */
    public String render() {
        var sb = new StringBuilder().append(path).append(": ").append(message);
        if (expected == null && actual == null) return sb.toString();
        sb.append(" (expected ").append(expected == null ? "nothing" : expected.shortName());
        sb.append(", got ").append(JsonValue.typeNameOf(actual));
        if (actual != null) {
            var value = new StringBuilder();
            preview(actual, value);
            sb.append(' ').append(abbreviate(value.toString()));
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return render();
    }

    private static String article(TypeDescriptor descriptor) {
        var name = descriptor.shortName();
        return ("aeiou".indexOf(Character.toLowerCase(name.charAt(0))) >= 0 ? "an " : "a ") + name;
    }

    /**
     * JSON text of {@code value}, cut off once it is longer than the report shows. Nesting levels each add
     * at least one character, so the descent stays shallow however deep the value is.
     */
    private static void preview(JsonValue value, StringBuilder out) {
        if (out.length() > MAX_VALUE_LENGTH) return;
        if (value instanceof JsonArray array) {
            out.append('[');
            var elements = array.value();
            for (int i = 0; i < elements.size() && out.length() <= MAX_VALUE_LENGTH; i++) {
                if (i > 0) out.append(',');
                preview(elements.get(i), out);
            }
            out.append(']');
        } else if (value instanceof JsonObject object) {
            out.append('{');
            var first = true;
            for (var en : object.value().entrySet()) {
                if (out.length() > MAX_VALUE_LENGTH) break;
                if (!first) out.append(',');
                first = false;
                out.append(new JsonString(en.getKey()).stringify()).append(':');
                preview(en.getValue(), out);
            }
            out.append('}');
        } else {
            out.append(value.stringify());
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= MAX_VALUE_LENGTH ? s : s.substring(0, MAX_VALUE_LENGTH - 3) + "...";
    }
}
