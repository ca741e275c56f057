package com.think.protocol.util;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.think.script.ExecutionResult;
import com.think.script.parser.Value;
import com.think.script.trace.TraceEvent;

/**
 * JSON export of execution results for external renderers.
 *
 * Values map onto JSON naturally (None becomes null, dicts objects, lists
 * arrays). Task states become {@code {"Task": {"var": value}}} and events
 * {@code [{"kind", "depth", "label", "detail", "line", "message"}]}.
 */
public final class StateJson {

    private static final ObjectMapper om = new ObjectMapper();

    private StateJson() {}

    public static JsonNode value(Value v) {
        switch (v.getType()) {
            case INT:    return om.getNodeFactory().numberNode(v.asInt());
            case FLOAT:  return om.getNodeFactory().numberNode(v.asNumber());
            case STRING: return om.getNodeFactory().textNode(v.asString());
            case BOOL:   return om.getNodeFactory().booleanNode(v.asBool());
            case LIST: {
                ArrayNode arr = om.createArrayNode();
                for (Value item : v.asList()) arr.add(value(item));
                return arr;
            }
            case DICT: {
                ObjectNode obj = om.createObjectNode();
                for (Map.Entry<String, Value> e : v.asDict().entrySet()) obj.set(e.getKey(), value(e.getValue()));
                return obj;
            }
            default:
                return om.nullNode();
        }
    }

    public static ObjectNode taskStates(Map<String, Map<String, Value>> states) {
        ObjectNode root = om.createObjectNode();
        for (Map.Entry<String, Map<String, Value>> task : states.entrySet()) {
            ObjectNode vars = root.putObject(task.getKey());
            for (Map.Entry<String, Value> v : task.getValue().entrySet()) {
                vars.set(v.getKey(), value(v.getValue()));
            }
        }
        return root;
    }

    public static ArrayNode events(List<TraceEvent> events) {
        ArrayNode arr = om.createArrayNode();
        for (TraceEvent e : events) {
            ObjectNode ev = arr.addObject();
            ev.put("kind", e.kind().name());
            ev.put("depth", e.depth());
            ev.put("label", e.label());
            ev.put("detail", e.detail());
            if (e.line() > 0) ev.put("line", e.line());
            ev.put("message", e.message());
        }
        return arr;
    }

    /** {@code {"output": [...], "tasks": {...}, "events": [...]}}. */
    public static ObjectNode result(ExecutionResult result) {
        ObjectNode root = om.createObjectNode();
        ArrayNode out = root.putArray("output");
        for (String line : result.getOutputLines()) out.add(line);
        root.set("tasks", taskStates(result.getTaskStates()));
        root.set("events", events(result.getEvents()));
        return root;
    }

    public static String toJson(ExecutionResult result) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(result(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution result", e);
        }
    }
}
