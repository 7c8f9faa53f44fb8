package params;

/**
 * Boolean node.
 *
 * @since 0.1.0
 */
public record JsonBoolean(boolean value) implements JsonValue {
    @Override
    public String stringify() {
        return value ? "true" : "false";
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public Object toJava() {
        return value;
    }
}
