package space.sparkradar.units;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SafeParseTest {

    @Test
    void parsesNumericText() {
        assertEquals(29.92, SafeParse.parseDouble(" 29.92 "));
        assertEquals(72, SafeParse.parseInt("72.9"));
        assertNull(SafeParse.parseDouble("NA"));
        assertNull(SafeParse.parseDouble(""));
        assertNull(SafeParse.parseDouble("NaN"));
    }

    @Test
    void readsNodesOfEitherShape() throws Exception {
        var node = new ObjectMapper().readTree("{\"a\":12.5,\"b\":\"40\",\"c\":\"--\",\"d\":null,\"e\":[1]}");
        assertEquals(12.5, SafeParse.toDouble(node.get("a")));
        assertEquals(40, SafeParse.toInt(node.get("b")));
        assertEquals(40L, SafeParse.toLong(node.get("b")));
        assertNull(SafeParse.toDouble(node.get("c")));
        assertNull(SafeParse.toDouble(node.get("d")));
        assertNull(SafeParse.toDouble(node.path("missing")));
        assertNull(SafeParse.toDouble(node.get("e")));
    }

    @Test
    void textSkipsBlankAndContainers() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        assertEquals("Rain", SafeParse.text(f.textNode("Rain")));
        assertNull(SafeParse.text(f.textNode("  ")));
        assertNull(SafeParse.text(f.objectNode()));
        assertNull(SafeParse.text(f.nullNode()));
    }
}
