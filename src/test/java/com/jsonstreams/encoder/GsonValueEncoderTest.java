package com.jsonstreams.encoder;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.jsonstreams.core.InvalidTypeException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GsonValueEncoderTest {

    private final GsonValueEncoder encoder = new GsonValueEncoder();

    static final class Row {
        String name = "widget";
        int count = 2;
        String note = null;
    }

    @Test
    void testScalars() {
        assertEquals("null", encoder.encode(null));
        assertEquals("\"foo\"", encoder.encode("foo"));
        assertEquals("1", encoder.encode(1));
        assertEquals("1.0", encoder.encode(1.0));
        assertEquals("false", encoder.encode(false));
    }

    @Test
    void testNoHtmlEscaping() {
        assertEquals("\"<a href='x'>\"", encoder.encode("<a href='x'>"));
    }

    @Test
    void testObjectFieldsIncludingNulls() {
        assertEquals("{\"name\":\"widget\",\"count\":2,\"note\":null}", encoder.encode(new Row()));
    }

    @Test
    void testMapKeepsOrder() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("z", 1);
        map.put("a", Arrays.asList("x", null));
        assertEquals("{\"z\":1,\"a\":[\"x\",null]}", encoder.encode(map));
    }

    @Test
    void testJsonElementPassThrough() {
        assertEquals("{\"a\":[1,2]}", encoder.encode(JsonParser.parseString("{ \"a\" : [ 1, 2 ] }")));
    }

    @Test
    void testIndentedAtDepth() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", Arrays.asList(1, 2));
        assertEquals("{\n  \"a\": [\n    1,\n    2\n  ]\n}", encoder.encode(map, 2, 0));
        assertEquals("{\n    \"a\": [\n      1,\n      2\n    ]\n  }", encoder.encode(map, 2, 1));
    }

    @Test
    void testRejectsNonFiniteTreeValues() {
        assertThrows(InvalidTypeException.class, () -> encoder.encode(new JsonPrimitive(Double.NaN)));

        JsonArray nested = new JsonArray();
        nested.add(1);
        nested.add(Double.POSITIVE_INFINITY);
        assertThrows(InvalidTypeException.class, () -> encoder.encode(nested));
        assertThrows(InvalidTypeException.class, () -> encoder.encode(nested, 2, 1));
    }

    @Test
    void testRejectsNonFiniteValues() {
        assertThrows(InvalidTypeException.class, () -> encoder.encode(Double.NaN));
        assertThrows(InvalidTypeException.class, () -> encoder.encode(Arrays.asList(1.0, Double.NEGATIVE_INFINITY)));
    }

    @Test
    void testCustomGsonPrettyPrintingIgnoredWhenCompact() {
        GsonValueEncoder custom = new GsonValueEncoder(new GsonBuilder().setPrettyPrinting().create());
        assertEquals("{\"a\":[1]}", custom.encode(JsonParser.parseString("{\"a\":[1]}")));
    }
}
