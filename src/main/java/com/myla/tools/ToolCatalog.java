package com.myla.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tools of the relevant agents, keyed by (agent, tool). Rebuilt for every query.
 */
public class ToolCatalog {

    private final Map<ToolKey, Entry> tools = new LinkedHashMap<>();

    public void register(ToolDescriptor descriptor, Tool tool) {
        if (tools.containsKey(descriptor.key())) {
            throw new IllegalArgumentException("Duplicate tool: " + descriptor.qualifiedName());
        }
        tools.put(descriptor.key(), new Entry(descriptor, tool));
    }

    public boolean contains(ToolKey key) {
        return tools.containsKey(key);
    }

    public Tool get(ToolKey key) {
        var entry = tools.get(key);
        return entry != null ? entry.tool() : null;
    }

    public List<ToolDescriptor> descriptors() {
        var result = new ArrayList<ToolDescriptor>(tools.size());
        for (var entry : tools.values()) result.add(entry.descriptor());
        return result;
    }

    public Collection<String> agentIds() {
        return tools.keySet().stream().map(ToolKey::agentId).distinct().toList();
    }

    public int size() {
        return tools.size();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    /**
     * Decodes the namespaced name once and calls the registered tool.
     */
    public ToolResult dispatch(String qualifiedName, ToolContext ctx, JsonNode input) {
        ToolKey key;
        try {
            key = ToolNames.split(qualifiedName);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Unknown tool: " + qualifiedName);
        }
        var tool = get(key);
        if (tool == null) {
            return ToolResult.error("Agent " + key.agentId() + " has no tool " + key.toolName());
        }
        return tool.execute(ctx, input);
    }

    private record Entry(ToolDescriptor descriptor, Tool tool) {}
}
