package com.quarry.formula.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON bridge for {@link Value}.
 *
 * JSON -> Value: numbers, strings, booleans, null, arrays and objects map one to one.
 * Value -> JSON: DATETIME is written as an ISO-8601 string, integral numbers as integers.
 */
public final class ValueJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nil();
        if (node.isNumber()) return Value.number(node.asDouble());
        if (node.isBoolean()) return Value.bool(node.asBoolean());
        if (node.isTextual()) return Value.text(node.asText());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.list(items);
        }
        if (node.isObject()) {
            return Value.map(fromJsonObject(node));
        }
        return Value.text(node.asText());
    }

    /** Converts every field of a JSON object; non-objects yield an empty map. */
    public static Map<String, Value> fromJsonObject(JsonNode node) {
        Map<String, Value> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return out;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), fromJson(e.getValue()));
        }
        return out;
    }

    public static JsonNode toJson(Value v) {
        if (v == null) return NODES.nullNode();
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) return NODES.numberNode((long) d);
                return NODES.numberNode(d);
            }
            case TEXT:
                return NODES.textNode(v.asText());
            case BOOL:
                return NODES.booleanNode(v.asBool());
            case DATETIME:
                return NODES.textNode(v.asDateTime().toString());
            case LIST: {
                ArrayNode arr = NODES.arrayNode();
                for (Value item : v.asList()) arr.add(toJson(item));
                return arr;
            }
            case MAP: {
                ObjectNode obj = NODES.objectNode();
                for (Map.Entry<String, Value> e : v.asMap().entrySet()) obj.set(e.getKey(), toJson(e.getValue()));
                return obj;
            }
            default:
                return NODES.nullNode();
        }
    }

    public static String toJsonString(Value v) {
        try {
            return MAPPER.writeValueAsString(toJson(v));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Value is not serializable: " + e.getMessage(), e);
        }
    }
}
