package params;

import java.util.Objects;

/**
 * Number node. Parsed numbers hold the narrowest {@link Number} that keeps the exact value.
 *
 * @since 0.1.0
 */
public record JsonNumber(Number value) implements JsonValue {
    public JsonNumber {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String stringify() {
        return value.toString();
    }

    @Override
    public String typeName() {
        return "number";
    }

    @Override
    public Object toJava() {
        return value;
    }
}
