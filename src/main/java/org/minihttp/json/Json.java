package org.minihttp.json;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the JSON codec, plus conversion from plain Java values
 * (maps, lists, strings, numbers, booleans, null) so handlers do not have to
 * build {@link JsonValue} trees by hand.
 */
public final class Json {

    private Json() {}

    public static JsonValue parse(String json) {
        return JsonParser.parse(json);
    }

    public static String format(JsonValue value) {
        return JsonFormatter.format(value);
    }

    /** Converts {@code value} with {@link #toValue(Object)} and formats it. */
    public static String stringify(Object value) {
        return JsonFormatter.format(toValue(value));
    }

    /**
     * Maps a Java value onto the JSON variants.
     *
     * @throws UnsupportedTypeException for types with no JSON counterpart
     */
    public static JsonValue toValue(Object value) {
        if (value == null) return JsonValue.Null.INSTANCE;
        if (value instanceof JsonValue v) return v;
        if (value instanceof Boolean b) return JsonValue.of(b);
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return JsonValue.of(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return JsonValue.of(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence s) return JsonValue.of(s.toString());
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new UnsupportedTypeException("object keys must be strings, got "
                            + (e.getKey() == null ? "null" : e.getKey().getClass().getName()));
                }
                members.put(key, toValue(e.getValue()));
            }
            return new JsonValue.Object(members);
        }
        if (value instanceof Iterable<?> items) {
            List<JsonValue> elements = new ArrayList<>();
            for (Object item : items) elements.add(toValue(item));
            return new JsonValue.Array(elements);
        }
        if (value instanceof Object[] items) {
            return toValue(Arrays.asList(items));
        }
        throw new UnsupportedTypeException("unsupported type in JSON conversion: " + value.getClass().getName());
    }
}
