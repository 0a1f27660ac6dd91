package com.myla.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.tools.Tool;
import com.myla.tools.ToolContext;
import com.myla.tools.ToolResult;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent living inside this process, exposing a fixed set of tools.
 */
public class LocalAgentChannel implements AgentChannel {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public LocalAgentChannel(Collection<? extends Tool> tools) {
        for (var tool : tools) {
            if (this.tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool: " + tool.name());
            }
        }
    }

    @Override
    public List<OperationDef> listOperations() {
        return tools.values().stream()
            .map(t -> new OperationDef(t.name(), t.description(), t.inputSchema()))
            .toList();
    }

    @Override
    public ToolResult invoke(String operation, JsonNode arguments) {
        var tool = tools.get(operation);
        if (tool == null) return ToolResult.error("Unknown tool: " + operation);
        return tool.execute(ToolContext.none(), arguments);
    }

    @Override
    public void close() {
        tools.clear();
    }
}
