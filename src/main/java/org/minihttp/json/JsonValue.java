package org.minihttp.json;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON value: exactly one of seven variants, each an immutable record.
 * <p>
 * Consumers branch on {@link #kind()} or on the concrete record type. Containers
 * copy their input, so a value never changes after construction.
 * </p>
 */
public interface JsonValue {

    enum Kind { NULL, BOOL, INT, FLOAT, TEXT, ARRAY, OBJECT }

    Kind kind();

    record Null() implements JsonValue {
        public static final Null INSTANCE = new Null();

        @Override public Kind kind() { return Kind.NULL; }
    }

    record Bool(boolean value) implements JsonValue {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        @Override public Kind kind() { return Kind.BOOL; }
    }

    record Int(long value) implements JsonValue {
        @Override public Kind kind() { return Kind.INT; }
    }

    record Float(double value) implements JsonValue {
        @Override public Kind kind() { return Kind.FLOAT; }
    }

    record Text(String value) implements JsonValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override public Kind kind() { return Kind.TEXT; }
    }

    record Array(List<JsonValue> elements) implements JsonValue {
        public Array {
            elements = List.copyOf(elements);
        }

        public JsonValue get(int index) { return elements.get(index); }

        public int size() { return elements.size(); }

        @Override public Kind kind() { return Kind.ARRAY; }
    }

    /** Keys are unique and keep insertion order. */
    record Object(Map<String, JsonValue> members) implements JsonValue {
        public Object {
            Map<String, JsonValue> copy = new LinkedHashMap<>();
            members.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value")));
            members = Collections.unmodifiableMap(copy);
        }

        public JsonValue get(String key) { return members.get(key); }

        public int size() { return members.size(); }

        @Override public Kind kind() { return Kind.OBJECT; }
    }

    static Bool of(boolean value) { return value ? Bool.TRUE : Bool.FALSE; }

    static Int of(long value) { return new Int(value); }

    static Float of(double value) { return new Float(value); }

    static Text of(String value) { return new Text(value); }

    static Array array(JsonValue... elements) { return new Array(Arrays.asList(elements)); }

    static Object object(Map<String, JsonValue> members) { return new Object(members); }
}
