package params;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable, named declaration of the fields a params object must have.
 *
 * <p> A schema is declared either by name, producing {@link ParamsObject} instances:
 * <pre>{@code
 * Schema<ParamsObject> rowNames = Schema.builder("RowNames")
 *         .field("TOTAL_ROW", string())
 *         .field("QUESTION_ROW", string())
 *         .build();
 * }</pre>
 * or from a record class, producing instances of that record:
 * <pre>{@code
 * Schema<RowNames> rowNames = Schema.of(RowNames.class);
 * }</pre>
 *
 * <p> Declaration defects (missing descriptors, unsupported types, nesting cycles) fail here with
 * {@link Params.ConfigurationException}, never while building an instance.
 *
 * @param <T> instance type
 * @since 0.1.0
 */
public final class Schema<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Schema.class);

    private final String name;
    private final Class<T> type;
    private final List<Field> fields;
    private final Map<String, TypeDescriptor> declaredFields;
    private final @Nullable Constructor<T> constructor;

    /**
     * One declared field.
     *
     * @param name       Java-facing name, the record component name for record schemas
     * @param key        member name in the params document
     * @param descriptor expected shape
     */
    public record Field(String name, String key, TypeDescriptor descriptor) {}

    Schema(String name, Class<T> type, List<Field> fields, @Nullable Constructor<T> constructor) {
        this.name = name;
        this.type = type;
        this.fields = List.copyOf(fields);
        var byKey = new LinkedHashMap<String, TypeDescriptor>();
        for (var f : fields) byKey.put(f.key(), f.descriptor());
        this.declaredFields = Collections.unmodifiableMap(byKey);
        this.constructor = constructor;
    }

    /**
     * Schema of a record class, derived once from its components and cached.
     */
    public static <R extends Record> Schema<R> of(Class<R> recordType) {
        Objects.requireNonNull(recordType, "recordType");
        return SchemaIntrospector.schemaOf(recordType);
    }

    /**
     * Declare a schema by name; instances are {@link ParamsObject}s.
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Declare a record schema with explicit descriptors for some components, e.g. a {@link TypeDescriptor#union}
     * for an {@code Object} component. Components without an override are derived from their type.
     */
    public static <R extends Record> RecordBuilder<R> forRecord(Class<R> recordType) {
        return new RecordBuilder<>(Objects.requireNonNull(recordType, "recordType"));
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public List<Field> fields() {
        return fields;
    }

    /**
     * @return document member name to descriptor, in declaration order
     */
    public Map<String, TypeDescriptor> declaredFields() {
        return declaredFields;
    }

    /**
     * Create an instance from fully matched field values.
     *
     * @throws InvocationTargetException if a record constructor rejects the values
     */
    @SuppressWarnings("unchecked")
    T instantiate(Map<String, Object> valuesByName) throws InvocationTargetException {
        if (constructor == null) return (T) new ParamsObject(this, valuesByName);
        var args = new Object[fields.size()];
        for (int i = 0; i < args.length; i++) args[i] = valuesByName.get(fields.get(i).name());
        try {
            return constructor.newInstance(args);
        } catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
            throw new Params.ConfigurationException("Failed to construct record instance of type " + type.getName(), e);
        }
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(name).append('{');
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(fields.get(i).key()).append(": ").append(fields.get(i).descriptor().shortName());
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final String name;
        private final List<Field> fields = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) throw new Params.ConfigurationException("Schema name must not be blank");
            this.name = name;
        }

        public Builder field(String fieldName, TypeDescriptor descriptor) {
            if (fieldName == null || fieldName.isBlank())
                throw new Params.ConfigurationException("Schema " + name + " declares a field with a blank name");
            if (descriptor == null)
                throw new Params.ConfigurationException(
                        "Field '" + fieldName + "' of schema " + name + " has no type descriptor");
            for (var f : fields) {
                if (f.name().equals(fieldName))
                    throw new Params.ConfigurationException(
                            "Field '" + fieldName + "' is declared twice in schema " + name);
            }
            fields.add(new Field(fieldName, fieldName, descriptor));
            return this;
        }

        public Schema<ParamsObject> build() {
            if (fields.isEmpty())
                throw new Params.ConfigurationException("Schema " + name + " does not declare any fields");
            var schema = new Schema<>(name, ParamsObject.class, fields, null);
            LOGGER.debug("Declared schema {}", schema);
            return schema;
        }
    }

    public static final class RecordBuilder<R extends Record> {
        private final Class<R> type;
        private final Map<String, TypeDescriptor> overrides = new LinkedHashMap<>();

        private RecordBuilder(Class<R> type) {
            this.type = type;
        }

        public RecordBuilder<R> field(String componentName, TypeDescriptor descriptor) {
            if (descriptor == null)
                throw new Params.ConfigurationException(
                        "Component '" + componentName + "' of record " + type.getName() + " has no type descriptor");
            if (overrides.put(componentName, descriptor) != null)
                throw new Params.ConfigurationException(
                        "Component '" + componentName + "' of record " + type.getName() + " is overridden twice");
            return this;
        }

        /**
         * Build the schema without registering it; {@link Schema#of} keeps returning the derived schema.
         */
        public Schema<R> build() {
            return SchemaIntrospector.introspect(type, overrides);
        }

        /**
         * Build the schema and register it as the schema of the record class, so that {@link Schema#of}
         * and records nesting this one use it.
         *
         * @throws Params.ConfigurationException if the record class already has a schema
         */
        public Schema<R> register() {
            return SchemaIntrospector.register(build());
        }
    }
}
