package nl.bytesoflife.circuitsync.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonParserTest {

    private final JsonParser parser = new JsonParser();

    @Test
    void keepsMemberOrderAndNumberKinds() {
        Map<String, Object> json = parser.parseObject(
                "{\"b\": 1, \"a\": [2.5, -3, 10000000000, true, null], \"c\": \"x\\\"y\\u0041\"}");

        assertEquals(List.of("b", "a", "c"), List.copyOf(json.keySet()));
        assertEquals(1, json.get("b"));
        List<Object> array = JsonParser.asList(json.get("a"));
        assertEquals(2.5, array.get(0));
        assertEquals(-3, array.get(1));
        assertEquals(10000000000L, array.get(2));
        assertEquals(Boolean.TRUE, array.get(3));
        assertNull(array.get(4));
        assertEquals("x\"yA", json.get("c"));
    }

    @Test
    void lenientAccessors() {
        assertTrue(JsonParser.asObject("text").isEmpty());
        assertTrue(JsonParser.asList(null).isEmpty());
        assertNull(JsonParser.asString(null));
        assertEquals(1.27, JsonParser.toDouble("1.27"));
        assertEquals(0, JsonParser.toDouble(null));
    }

    @Test
    void reportsErrorLocation() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\n  \"a\": tru\n}"));
        assertEquals("JSON expected true at 2:8", e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> parser.parse("[1, 2"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{} x"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseObject("[]"));
    }
}
