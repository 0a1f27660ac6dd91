package com.myla.tools;

/**
 * The (agent, tool) pair a namespaced tool name stands for.
 */
public record ToolKey(String agentId, String toolName) {

    public String qualifiedName() {
        return ToolNames.qualify(agentId, toolName);
    }
}
