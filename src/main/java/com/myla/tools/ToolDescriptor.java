package com.myla.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(
    String agentId,
    String name,
    String description,
    JsonNode inputSchema
) {
    public ToolKey key() {
        return new ToolKey(agentId, name);
    }

    public String qualifiedName() {
        return ToolNames.qualify(agentId, name);
    }
}
