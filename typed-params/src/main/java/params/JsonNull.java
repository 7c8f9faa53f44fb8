package params;

/**
 * Explicit JSON {@code null}. An absent member has no node at all.
 *
 * @since 0.1.0
 */
public record JsonNull() implements JsonValue {
    @Override
    public String stringify() {
        return "null";
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public Object toJava() {
        return null;
    }
}
