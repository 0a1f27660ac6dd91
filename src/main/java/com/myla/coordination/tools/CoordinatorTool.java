package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myla.coordination.AgentRole;
import com.myla.coordination.Coordinator;
import com.myla.coordination.UnknownTaskException;
import com.myla.coordination.UnknownWorkflowException;
import com.myla.tools.Tool;
import com.myla.tools.ToolContext;
import com.myla.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for the coordinator's tool surface. Every failure becomes an error result, never an exception.
 */
abstract class CoordinatorTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorTool.class);
    static final ObjectMapper MAPPER = new ObjectMapper();

    protected final Coordinator coordinator;

    CoordinatorTool(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public final ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = input != null && input.isObject() ? input : MAPPER.createObjectNode();
        try {
            return ToolResult.ok(run(args));
        } catch (IllegalArgumentException | UnknownTaskException | UnknownWorkflowException e) {
            log.warn("{} rejected: {}", name(), e.getMessage());
            return ToolResult.error("Error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed", name(), e);
            return ToolResult.error("Error: " + name() + " failed: " + e);
        }
    }

    protected abstract String run(JsonNode args);

    static String requireText(JsonNode args, String field) {
        var node = args.get(field);
        if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return node.asText();
    }

    static AgentRole requireAgent(JsonNode args, String field) {
        return AgentRole.fromKey(requireText(args, field));
    }

    static List<String> textList(JsonNode args, String field) {
        var node = args.get(field);
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) throw new IllegalArgumentException("'" + field + "' must be an array");
        var values = new ArrayList<String>();
        for (var item : node) values.add(item.asText());
        return values;
    }

    static Map<String, Object> objectMap(JsonNode args, String field) {
        var node = args.get(field);
        if (node == null || node.isNull()) return Map.of();
        if (!node.isObject()) throw new IllegalArgumentException("'" + field + "' must be an object");
        @SuppressWarnings("unchecked")
        Map<String, Object> map = MAPPER.convertValue(node, LinkedHashMap.class);
        return map;
    }

    // --- schema helpers ---

    static ObjectNode schema(ObjectNode properties, String... required) {
        var schema = MAPPER.createObjectNode().put("type", "object");
        schema.set("properties", properties);
        if (required.length > 0) {
            ArrayNode req = schema.putArray("required");
            for (var r : required) req.add(r);
        }
        return schema;
    }

    static ObjectNode properties() {
        return MAPPER.createObjectNode();
    }

    static ObjectNode string(String description) {
        return MAPPER.createObjectNode().put("type", "string").put("description", description);
    }

    static ObjectNode oneOf(String description, String... values) {
        var node = string(description);
        var e = node.putArray("enum");
        Arrays.stream(values).forEach(e::add);
        return node;
    }

    static ObjectNode agentEnum(String description) {
        return oneOf(description, Arrays.stream(AgentRole.values()).map(AgentRole::key).toArray(String[]::new));
    }

    static ObjectNode bool(String description, boolean defaultValue) {
        return MAPPER.createObjectNode().put("type", "boolean").put("description", description)
            .put("default", defaultValue);
    }

    static ObjectNode object(String description) {
        return MAPPER.createObjectNode().put("type", "object").put("description", description);
    }

    static ObjectNode array(String description, ObjectNode items) {
        var node = MAPPER.createObjectNode().put("type", "array").put("description", description);
        node.set("items", items);
        return node;
    }
}
