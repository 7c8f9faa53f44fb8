package params;

import java.lang.reflect.RecordComponent;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * Generic, untyped value tree of a parsed params document.
 *
 * <p> This is the raw input of {@link Params#construct(Schema, Object)}: scalars, ordered arrays and
 * string-keyed objects, exactly the JSON value model.
 *
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    String stringify();

    /**
     * @return short JSON type name, used in error reports
     */
    String typeName();

    /**
     * Convert to plain Java: {@code null}, {@link Boolean}, {@link Number}, {@link String},
     * {@link List} and {@link Map}, preserving order.
     */
    @Nullable
    Object toJava();

    /**
     * Convert a Java object graph into a {@link JsonValue}, nesting at most {@link Params#DEFAULT_MAX_DEPTH} levels.
     *
     * @see #fromJavaObject(Object, int)
     */
    static JsonValue fromJavaObject(@Nullable Object o) {
        return fromJavaObject(o, Params.DEFAULT_MAX_DEPTH);
    }

    /**
     * Convert a Java object graph into a {@link JsonValue}.
     *
     * <p> Accepts JSON-like Java values (maps, iterables, arrays, strings, numbers, booleans, {@code null})
     * and typed instances (records and {@link ParamsObject}), which makes it the inverse of
     * {@link Params#construct(Schema, Object)}. Empty {@link Optional} members are omitted.
     *
     * @param o        any object, may be {@code null}
     * @param maxDepth deepest member or element allowed below {@code o}
     * @return non-null json value
     * @throws Params.DepthExceededException if {@code o} nests deeper than {@code maxDepth}, e.g. a list containing itself
     */
    static JsonValue fromJavaObject(@Nullable Object o, int maxDepth) {
        return fromJavaObject(o, FieldPath.root(), maxDepth);
    }

    @SneakyThrows
    private static JsonValue fromJavaObject(@Nullable Object o, FieldPath path, int maxDepth) {
        if (path.depth() > maxDepth) throw new Params.DepthExceededException(path, maxDepth);
        if (o == null) return new JsonNull();
        if (o instanceof JsonValue jsonValue) return jsonValue;
        if (o instanceof Number number) return new JsonNumber(number);
        if (o instanceof CharSequence string) return new JsonString(string.toString());
        if (o instanceof Character c) return new JsonString(String.valueOf(c));
        if (o instanceof Boolean bool) return new JsonBoolean(bool);
        if (o instanceof Enum<?> e) return new JsonString(e.name());
        if (o instanceof Optional<?> optional) return fromJavaObject(optional.orElse(null), path, maxDepth);
        if (o instanceof Path p)
            throw new Params.ConversionException("Cannot use path " + p + " as a raw value, read it with Params.read");
        if (o instanceof Object[] array) {
            var values = new ArrayList<JsonValue>(array.length);
            for (var e : array) values.add(fromJavaObject(e, path.index(values.size()), maxDepth));
            return new JsonArray(values);
        }
        if (o instanceof Iterable<?> iterable) {
            var values = new ArrayList<JsonValue>();
            for (var e : iterable) values.add(fromJavaObject(e, path.index(values.size()), maxDepth));
            return new JsonArray(values);
        }
        if (o instanceof Map<?, ?> map) {
            var values = new LinkedHashMap<String, JsonValue>();
            for (var en : map.entrySet()) {
                var key = String.valueOf(en.getKey());
                values.put(key, fromJavaObject(en.getValue(), path.field(key), maxDepth));
            }
            return new JsonObject(values);
        }
        if (o instanceof ParamsObject object) {
            var values = new LinkedHashMap<String, JsonValue>();
            for (var en : object.asMap().entrySet()) {
                var v = en.getValue();
                if (v instanceof Optional<?> optional && optional.isEmpty()) continue;
                values.put(en.getKey(), fromJavaObject(v, path.field(en.getKey()), maxDepth));
            }
            return new JsonObject(values);
        }
        if (o instanceof Record record) {
            var values = new LinkedHashMap<String, JsonValue>();
            for (RecordComponent c : record.getClass().getRecordComponents()) {
                var accessor = c.getAccessor();
                accessor.setAccessible(true);
                var v = accessor.invoke(record);
                if (v instanceof Optional<?> optional && optional.isEmpty()) continue;
                var key = SchemaIntrospector.keyOf(c);
                values.put(key, fromJavaObject(v, path.field(key), maxDepth));
            }
            return new JsonObject(values);
        }
        throw new Params.ConversionException(
                "Cannot convert " + o.getClass().getName() + " to a JSON value (not a JSON-like value or typed instance)");
    }

    static String typeNameOf(@Nullable JsonValue value) {
        return value == null ? "nothing" : value.typeName();
    }
}
