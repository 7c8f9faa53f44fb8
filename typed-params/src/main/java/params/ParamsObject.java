package params;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Typed instance of a schema declared with {@link Schema#builder(String)}.
 *
 * <p> Values are fully matched against their descriptors before an instance exists, so the typed getters only fail
 * for fields the schema does not declare or when asked for the wrong type, both programming errors.
 * Two instances are equal when they belong to the same schema and all field values are equal.
 */
public final class ParamsObject {

    private final Schema<?> schema;
    private final Map<String, Object> values;

    ParamsObject(Schema<?> schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Schema<?> schema() {
        return schema;
    }

    /**
     * @param field declared field name
     * @return the value; {@code null} only for an {@code any} field holding JSON null
     * @throws IllegalArgumentException if the schema declares no such field
     */
    public @Nullable Object get(String field) {
        if (!values.containsKey(field))
            throw new IllegalArgumentException("Schema " + schema.name() + " declares no field '" + field + "'");
        return values.get(field);
    }

    public <V> V get(String field, Class<V> type) {
        Object v = get(field);
        if (!type.isInstance(v))
            throw new ClassCastException("Field '" + field + "' of " + schema.name() + " holds "
                    + (v == null ? "null" : v.getClass().getSimpleName()) + ", not " + type.getSimpleName());
        return type.cast(v);
    }

    public String getString(String field) {
        return get(field, String.class);
    }

    public int getInt(String field) {
        return get(field, Integer.class);
    }

    public long getLong(String field) {
        return get(field, Long.class);
    }

    public double getDouble(String field) {
        return get(field, Double.class);
    }

    public BigDecimal getDecimal(String field) {
        return get(field, BigDecimal.class);
    }

    public boolean getBoolean(String field) {
        return get(field, Boolean.class);
    }

    public ParamsObject getObject(String field) {
        return get(field, ParamsObject.class);
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> getList(String field) {
        return get(field, List.class);
    }

    @SuppressWarnings("unchecked")
    public <K, V> Map<K, V> getMap(String field) {
        return get(field, Map.class);
    }

    @SuppressWarnings("unchecked")
    public <V> Optional<V> getOptional(String field) {
        return get(field, Optional.class);
    }

    /**
     * @return field name to value, in declaration order
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParamsObject p && schema == p.schema && values.equals(p.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.name(), values);
    }

    @Override
    public String toString() {
        return schema.name() + values;
    }
}
