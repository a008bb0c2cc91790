package org.minihttp.json;

import java.util.Iterator;
import java.util.Map;

/**
 * Writes a {@link JsonValue} as compact text.
 * <p>
 * Text values are wrapped in quotes as-is, without escaping, mirroring
 * {@link JsonParser} which never decodes escapes. Object members are written in
 * the map's iteration order.
 * </p>
 */
public final class JsonFormatter {

    private JsonFormatter() {}

    /**
     * @throws UnsupportedTypeException if the tree holds something other than the
     *         seven {@link JsonValue} variants, or a non-finite float
     */
    public static String format(JsonValue value) {
        StringBuilder out = new StringBuilder();
        write(out, value);
        return out.toString();
    }

    private static void write(StringBuilder out, JsonValue value) {
        if (value instanceof JsonValue.Null) {
            out.append("null");
        } else if (value instanceof JsonValue.Bool b) {
            out.append(b.value());
        } else if (value instanceof JsonValue.Int i) {
            out.append(i.value());
        } else if (value instanceof JsonValue.Float f) {
            if (!Double.isFinite(f.value())) {
                throw new UnsupportedTypeException("non-finite number " + f.value());
            }
            out.append(f.value());
        } else if (value instanceof JsonValue.Text t) {
            out.append('"').append(t.value()).append('"');
        } else if (value instanceof JsonValue.Array a) {
            writeArray(out, a);
        } else if (value instanceof JsonValue.Object o) {
            writeObject(out, o);
        } else {
            throw new UnsupportedTypeException("cannot format "
                    + (value == null ? "null reference" : value.getClass().getName()));
        }
    }

    private static void writeArray(StringBuilder out, JsonValue.Array array) {
        out.append('[');
        Iterator<JsonValue> it = array.elements().iterator();
        while (it.hasNext()) {
            write(out, it.next());
            if (it.hasNext()) out.append(',');
        }
        out.append(']');
    }

    private static void writeObject(StringBuilder out, JsonValue.Object object) {
        out.append('{');
        Iterator<Map.Entry<String, JsonValue>> it = object.members().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, JsonValue> e = it.next();
            out.append('"').append(e.getKey()).append("\":");
            write(out, e.getValue());
            if (it.hasNext()) out.append(',');
        }
        out.append('}');
    }
}
