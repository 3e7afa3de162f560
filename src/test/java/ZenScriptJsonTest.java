import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zen.script.ZenScript;
import com.zen.script.runtime.TypeError;
import com.zen.script.runtime.Value;
import com.zen.script.util.ValueJson;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ZenScriptJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void fromJsonObject_mapsEveryNodeKind() throws Exception {
        JsonNode root = om.readTree(
                "{\"n\": 1, \"f\": 1.5, \"s\": \"x\", \"b\": true, \"a\": [1, 2], \"m\": {\"k\": null}}");

        Map<String, Value> values = ValueJson.fromJsonObject(root);

        assertEquals(Value.int64(1), values.get("n"));
        assertEquals(Value.float64(1.5), values.get("f"));
        assertEquals(Value.string("x"), values.get("s"));
        assertEquals(Value.bool(true), values.get("b"));
        assertEquals(Value.Type.ARRAY, values.get("a").type);
        assertEquals(2, values.get("a").asArray().size());
        assertEquals(Value.nil(), values.get("m").asMap().get("k"));
        assertArrayEquals(new String[] { "n", "f", "s", "b", "a", "m" }, values.keySet().toArray());
    }

    @Test
    void fromJsonObject_requiresAnObject() throws Exception {
        TypeError e = assertThrows(TypeError.class, () -> ValueJson.fromJsonObject(om.readTree("[1, 2]")));
        assertEquals("Type error: expected a JSON object, got ARRAY", e.getMessage());
    }

    @Test
    void scriptResults_roundTripThroughJson() throws Exception {
        ZenScript zen = new ZenScript();
        Map<String, Value> globals = zen.run(
                "func helper() { }\n" +
                "var count = 3\n" +
                "var ratio: float = 0.25\n" +
                "var tags = [\"a\", \"b\"]\n" +
                "var meta = {\"ok\": true, \"none\": null}\n"
        );

        ObjectNode json = ValueJson.globalsToJson(globals);

        assertFalse(json.has("helper"), "functions have no JSON form");
        assertEquals("{\"count\":3,\"ratio\":0.25,\"tags\":[\"a\",\"b\"],\"meta\":{\"ok\":true,\"none\":null}}",
                om.writeValueAsString(json));
    }

    @Test
    void inputs_feedScriptGlobals() throws Exception {
        Map<String, Value> inputs = ValueJson.fromJsonObject(om.readTree("{\"prices\": [2, 3.5], \"qty\": 4}"));

        Map<String, Value> globals = new ZenScript().run(
                "var total = 0.0\n" +
                "for p in prices {\n" +
                "    total += p * qty\n" +
                "}\n", inputs);

        assertEquals(Value.float64(22.0), globals.get("total"));
    }

    @Test
    void callables_haveNoJsonForm() {
        Map<String, Value> globals = new ZenScript().run("func f() { }");
        TypeError e = assertThrows(TypeError.class, () -> ValueJson.toJson(globals.get("f")));
        assertEquals("Type error: cannot convert function to JSON", e.getMessage());
    }
}
