package params;

import java.util.Objects;

/**
 * String node.
 *
 * @since 0.1.0
 */
public record JsonString(String value) implements JsonValue {
    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String stringify() {
        var sb = new StringBuilder(value.length() + 2).append('"');
        JsonReader.escapeTo(sb, value);
        return sb.append('"').toString();
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public Object toJava() {
        return value;
    }
}
