package org.minihttp;

import com.google.gson.JsonObject;
import org.minihttp.json.Json;
import org.minihttp.json.JsonFormatter;
import org.minihttp.json.JsonValue;
import org.minihttp.json.UnsupportedTypeException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFormatterTest {

    private static JsonValue sample() {
        Map<String, JsonValue> m = new LinkedHashMap<>();
        m.put("a", JsonValue.of(1L));
        m.put("b", JsonValue.array(JsonValue.of(true), JsonValue.of(false), JsonValue.Null.INSTANCE));
        m.put("c", JsonValue.of("x"));
        m.put("d", JsonValue.of(1.5));
        m.put("e", JsonValue.object(Map.of("f", JsonValue.of(2.0))));
        return JsonValue.object(m);
    }

    @Test
    void compactOutputInInsertionOrder() {
        assertEquals("{\"a\":1,\"b\":[true,false,null],\"c\":\"x\",\"d\":1.5,\"e\":{\"f\":2.0}}",
                JsonFormatter.format(sample()));
    }

    @Test
    void emptyContainers() {
        assertEquals("[]", JsonFormatter.format(JsonValue.array()));
        assertEquals("{}", JsonFormatter.format(JsonValue.object(Map.of())));
        assertEquals("[[],{}]", JsonFormatter.format(JsonValue.array(JsonValue.array(), JsonValue.object(Map.of()))));
    }

    @Test
    void outputIsReadableByGson() {
        JsonObject obj = com.google.gson.JsonParser.parseString(JsonFormatter.format(sample())).getAsJsonObject();
        assertEquals(1L, obj.get("a").getAsLong());
        assertEquals(3, obj.get("b").getAsJsonArray().size());
        assertTrue(obj.get("b").getAsJsonArray().get(2).isJsonNull());
        assertEquals("x", obj.get("c").getAsString());
        assertEquals(1.5, obj.get("d").getAsDouble());
        assertEquals(2.0, obj.getAsJsonObject("e").get("f").getAsDouble());
    }

    @Test
    void textIsNotEscaped() {
        assertEquals("[\"say \"hi\"\"]", JsonFormatter.format(JsonValue.array(JsonValue.of("say \"hi\""))));
        assertEquals("[\"a\\nb\"]", JsonFormatter.format(JsonValue.array(JsonValue.of("a\\nb"))));
    }

    @Test
    void foreignValuesAreUnsupported() {
        JsonValue foreign = () -> JsonValue.Kind.TEXT;
        assertThrows(UnsupportedTypeException.class, () -> JsonFormatter.format(foreign));
        assertThrows(UnsupportedTypeException.class,
                () -> JsonFormatter.format(JsonValue.array(JsonValue.of(1L), foreign)));
        assertThrows(UnsupportedTypeException.class, () -> JsonFormatter.format(null));
    }

    @Test
    void nonFiniteFloatsAreUnsupported() {
        assertThrows(UnsupportedTypeException.class,
                () -> JsonFormatter.format(JsonValue.array(JsonValue.of(Double.NaN))));
        assertThrows(UnsupportedTypeException.class,
                () -> JsonFormatter.format(JsonValue.array(JsonValue.of(Double.POSITIVE_INFINITY))));
    }

    @Test
    void stringifyConvertsPlainJavaValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", "5");
        m.put("n", 3);
        m.put("big", 4L);
        m.put("f", 0.25f);
        m.put("ok", true);
        m.put("none", null);
        m.put("list", List.of(1, "two"));
        m.put("arr", new Integer[]{7, 8});
        assertEquals("{\"id\":\"5\",\"n\":3,\"big\":4,\"f\":0.25,\"ok\":true,\"none\":null,"
                + "\"list\":[1,\"two\"],\"arr\":[7,8]}", Json.stringify(m));
    }

    @Test
    void stringifyRejectsUnknownTypes() {
        assertThrows(UnsupportedTypeException.class, () -> Json.stringify(new Object()));
        assertThrows(UnsupportedTypeException.class, () -> Json.stringify(new int[]{1, 2}));
        assertThrows(UnsupportedTypeException.class, () -> Json.stringify(Map.of(1, "x")));
        assertThrows(UnsupportedTypeException.class, () -> Json.stringify(Arrays.asList(1, new Object())));
    }

    @Test
    void valuesAreImmutable() {
        JsonValue.Array a = JsonValue.array(JsonValue.of(1L));
        assertThrows(UnsupportedOperationException.class, () -> a.elements().add(JsonValue.of(2L)));
        JsonValue.Object o = JsonValue.object(new LinkedHashMap<>(Map.of("k", JsonValue.of(1L))));
        assertThrows(UnsupportedOperationException.class, () -> o.members().put("z", JsonValue.of(2L)));
    }
}
