package params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Array node; element order is the order of the source document.
 *
 * @since 0.1.0
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {
    public JsonArray {
        value = Collections.unmodifiableList(new ArrayList<>(value));
    }

    @Override
    public String stringify() {
        return value.stream().map(JsonValue::stringify).collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public String typeName() {
        return "array";
    }

    @Override
    public Object toJava() {
        var list = new ArrayList<>(value.size());
        for (var e : value) list.add(e.toJava());
        return Collections.unmodifiableList(list);
    }
}
