package params;

import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives record schemas from record components, once per record class.
 */
final class SchemaIntrospector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaIntrospector.class);

    private static final Map<Class<?>, Schema<?>> schemas = new ConcurrentHashMap<>();

    private SchemaIntrospector() {
        throw new UnsupportedOperationException();
    }

    @SuppressWarnings("unchecked")
    static <R> Schema<R> schemaOf(Class<R> type) {
        var cached = (Schema<R>) schemas.get(type);
        if (cached != null) return cached;
        return schemaOf(type, new ArrayDeque<>());
    }

    static <R> Schema<R> introspect(Class<R> type, Map<String, TypeDescriptor> overrides) {
        return introspect(type, overrides, new ArrayDeque<>());
    }

    @SuppressWarnings("unchecked")
    static <R> Schema<R> register(Schema<R> schema) {
        var existing = (Schema<R>) schemas.putIfAbsent(schema.type(), schema);
        if (existing != null)
            throw new Params.ConfigurationException("A schema is already registered for " + schema.type().getName());
        LOGGER.debug("Registered schema {} for {}", schema, schema.type().getName());
        return schema;
    }

    static String keyOf(RecordComponent component) {
        var key = component.getAnnotation(ParamKey.class);
        return key == null ? component.getName() : key.value();
    }

    @SuppressWarnings("unchecked")
    private static <R> Schema<R> schemaOf(Class<R> type, Deque<Class<?>> resolving) {
        var cached = (Schema<R>) schemas.get(type);
        if (cached != null) return cached;
        var schema = introspect(type, Map.of(), resolving);
        var existing = (Schema<R>) schemas.putIfAbsent(type, schema);
        return existing != null ? existing : schema;
    }

    private static <R> Schema<R> introspect(
            Class<R> type, Map<String, TypeDescriptor> overrides, Deque<Class<?>> resolving) {
        if (!type.isRecord()) throw new Params.ConfigurationException(type.getName() + " is not a record");
        var components = type.getRecordComponents();
        if (components.length == 0)
            throw new Params.ConfigurationException(
                    "Class definition for " + type.getSimpleName() + " does not contain any attributes");
        var names = new HashSet<String>();
        for (var c : components) names.add(c.getName());
        for (var name : overrides.keySet()) {
            if (!names.contains(name))
                throw new Params.ConfigurationException(
                        "Record " + type.getName() + " has no component '" + name + "' to override");
        }

        resolving.push(type);
        var fields = new ArrayList<Schema.Field>(components.length);
        var keys = new HashSet<String>();
        try {
            for (var c : components) {
                String where = "Component '" + c.getName() + "' of record " + type.getName();
                var descriptor = overrides.get(c.getName());
                if (descriptor == null) descriptor = describe(c.getGenericType(), resolving, where);
                checkAssignable(c, descriptor, where);
                var key = keyOf(c);
                if (!keys.add(key))
                    throw new Params.ConfigurationException(
                            where + " reads member '" + key + "', which another component already reads");
                fields.add(new Schema.Field(c.getName(), key, descriptor));
            }
        } finally {
            resolving.pop();
        }

        var schema = new Schema<>(type.getSimpleName(), type, fields, canonicalConstructor(type, components));
        LOGGER.debug("Introspected schema {} from {}", schema, type.getName());
        return schema;
    }

    static TypeDescriptor describe(Type t, Deque<Class<?>> resolving, String where) {
        if (t instanceof WildcardType w) {
            var uppers = w.getUpperBounds();
            t = uppers.length == 0 ? Object.class : uppers[0];
        }
        if (t instanceof TypeVariable<?> || t instanceof GenericArrayType)
            throw new Params.ConfigurationException(where + " has no resolvable type descriptor (type " + t + ")");
        if (t instanceof Class<?> c) return describeClass(c, resolving, where);
        if (t instanceof ParameterizedType p) {
            var raw = (Class<?>) p.getRawType();
            var args = p.getActualTypeArguments();
            if (raw == List.class || raw == Collection.class)
                return TypeDescriptor.listOf(describe(args[0], resolving, where));
            if (raw == java.util.Optional.class) return TypeDescriptor.optional(describe(args[0], resolving, where));
            if (raw == Map.class) {
                var key = describe(args[0], resolving, where);
                if (!(key instanceof TypeDescriptor.Primitive))
                    throw new Params.ConfigurationException(where + " declares a map with non-primitive keys: " + t);
                return TypeDescriptor.mapOf(key, describe(args[1], resolving, where));
            }
            throw new Params.UnsupportedTypeException(where + " has unsupported type " + t.getTypeName());
        }
        throw new Params.UnsupportedTypeException(where + " has unsupported type " + t.getTypeName());
    }

    private static TypeDescriptor describeClass(Class<?> c, Deque<Class<?>> resolving, String where) {
        if (c == String.class) return TypeDescriptor.string();
        if (c == boolean.class || c == Boolean.class) return TypeDescriptor.bool();
        if (c == int.class || c == Integer.class) return TypeDescriptor.integer();
        if (c == long.class || c == Long.class) return TypeDescriptor.int64();
        if (c == double.class || c == Double.class) return TypeDescriptor.number();
        if (c == BigDecimal.class) return TypeDescriptor.decimal();
        if (c == Object.class) return TypeDescriptor.any();
        // untyped containers, as in a plain `list` or `dict` declaration
        if (c == List.class || c == Collection.class) return TypeDescriptor.listOf(TypeDescriptor.any());
        if (c == Map.class) return TypeDescriptor.mapOf(TypeDescriptor.any());
        if (c == java.util.Optional.class)
            throw new Params.ConfigurationException(where + " must declare the Optional element type");
        if (c.isRecord()) {
            if (resolving.contains(c)) {
                var cycle = new ArrayList<Class<?>>(resolving);
                Collections.reverse(cycle);
                cycle.add(c);
                throw new Params.ConfigurationException("Schema nesting cycle: "
                        + cycle.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> ")));
            }
            return TypeDescriptor.nested(schemaOf(c, resolving));
        }
        throw new Params.UnsupportedTypeException(where + " has unsupported type " + c.getName());
    }

    private static void checkAssignable(RecordComponent c, TypeDescriptor descriptor, String where) {
        var target = box(c.getType());
        if (!target.isAssignableFrom(descriptor.javaType()))
            throw new Params.ConfigurationException(where + " of type " + c.getType().getSimpleName()
                    + " cannot hold values of " + descriptor.shortName());
    }

    private static <R> Constructor<R> canonicalConstructor(Class<R> type, RecordComponent[] components) {
        var types = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) types[i] = components[i].getType();
        try {
            var ctor = type.getDeclaredConstructor(types);
            if (!Modifier.isPublic(ctor.getModifiers()) || !Modifier.isPublic(type.getModifiers()))
                ctor.setAccessible(true);
            return ctor;
        } catch (NoSuchMethodException e) {
            throw new Params.ConfigurationException("Record " + type.getName() + " has no canonical constructor", e);
        }
    }

    private static Class<?> box(Class<?> c) {
        if (!c.isPrimitive()) return c;
        if (c == boolean.class) return Boolean.class;
        if (c == int.class) return Integer.class;
        if (c == long.class) return Long.class;
        if (c == double.class) return Double.class;
        if (c == float.class) return Float.class;
        if (c == short.class) return Short.class;
        if (c == byte.class) return Byte.class;
        if (c == char.class) return Character.class;
        return Void.class;
    }
}
