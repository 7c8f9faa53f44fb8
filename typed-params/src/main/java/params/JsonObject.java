package params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Object node; member order is the order of the source document.
 *
 * @since 0.1.0
 */
public record JsonObject(Map<String, JsonValue> value) implements JsonValue {
    public JsonObject {
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    @Override
    public String stringify() {
        return value.entrySet().stream()
                .map(e -> new JsonString(e.getKey()).stringify() + ":" + e.getValue().stringify())
                .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public String typeName() {
        return "object";
    }

    @Override
    public Object toJava() {
        var map = new LinkedHashMap<String, Object>();
        for (var en : value.entrySet()) map.put(en.getKey(), en.getValue().toJava());
        return Collections.unmodifiableMap(map);
    }
}
