package com.zen.script.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zen.script.runtime.TypeError;
import com.zen.script.runtime.Value;

/**
 * Conversion between runtime values and Jackson JSON trees, the one place where host data
 * enters or leaves the interpreter.
 *
 * Integral JSON numbers become Int64, fractional ones Float64, objects Maps and arrays Arrays.
 * Callables have no JSON form.
 */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ValueJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    public static JsonNode toJson(Value v) {
        switch (v.type) {
            case INT32: return nodes.numberNode(v.asInt32());
            case INT64: return nodes.numberNode(v.asInt64());
            case FLOAT32: return nodes.numberNode(Double.parseDouble(Float.toString(v.asFloat32())));
            case FLOAT64: return nodes.numberNode(v.asFloat64());
            case STRING: return nodes.textNode(v.asString());
            case BOOL: return nodes.booleanNode(v.asBool());
            case NULL:
            case VOID: return nodes.nullNode();
            case ARRAY: {
                ArrayNode arr = nodes.arrayNode();
                for (Value item : v.asArray()) arr.add(toJson(item));
                return arr;
            }
            case MAP: {
                ObjectNode obj = nodes.objectNode();
                for (Map.Entry<String, Value> e : v.asMap().entrySet()) obj.set(e.getKey(), toJson(e.getValue()));
                return obj;
            }
            default:
                throw new TypeError("cannot convert " + v.type + " to JSON");
        }
    }

    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nil();
        if (node.isTextual()) return Value.string(node.asText());
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) throw new TypeError("JSON integer " + node + " out of range for int64");
            return Value.int64(node.longValue());
        }
        if (node.isNumber()) return Value.float64(node.doubleValue());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.array(items);
        }
        if (node.isObject()) return Value.map(fromJsonObject(node));
        throw new TypeError("unsupported JSON node " + node.getNodeType());
    }

    /** Fields of a JSON object as values, in document order. */
    public static Map<String, Value> fromJsonObject(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new TypeError("expected a JSON object, got " + (node == null ? "nothing" : node.getNodeType()));
        }
        Map<String, Value> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), fromJson(e.getValue()));
        }
        return out;
    }

    /** Variables as a JSON object. Callables are left out. */
    public static ObjectNode globalsToJson(Map<String, Value> globals) {
        ObjectNode obj = nodes.objectNode();
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            if (e.getValue().type.isCallable()) continue;
            obj.set(e.getKey(), toJson(e.getValue()));
        }
        return obj;
    }
}
