package com.myla.coordination;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Participants of inter-agent coordination, with their configuration key and connector agent id.
 */
public enum AgentRole {
    GITHUB("github", "github-agent", "GitHub"),
    JIRA("jira", "jira-agent", "JIRA"),
    PRODUCT_MANAGER("product_manager", "product-manager-agent", "Product Manager"),
    GOOGLE_DOCS("google_docs", "google-docs-agent", "Google Docs"),
    ORCHESTRATOR("orchestrator", "inter-agent-coordinator", "Orchestrator");

    private final String key;
    private final String agentId;
    private final String displayName;

    AgentRole(String key, String agentId, String displayName) {
        this.key = key;
        this.agentId = agentId;
        this.displayName = displayName;
    }

    @JsonValue
    public String key() { return key; }
    public String agentId() { return agentId; }
    public String displayName() { return displayName; }

    public static AgentRole fromKey(String key) {
        for (var role : values()) {
            if (role.key.equals(key)) return role;
        }
        throw new IllegalArgumentException("Unknown agent '" + key + "', expected one of " + keys(List.of(values())));
    }

    public static Optional<AgentRole> fromAgentId(String agentId) {
        return Arrays.stream(values()).filter(r -> r.agentId.equals(agentId)).findFirst();
    }

    /** Roles that take work; the orchestrator only assigns it. */
    public static List<AgentRole> workers() {
        return Arrays.stream(values()).filter(r -> r != ORCHESTRATOR).toList();
    }

    public static String keys(List<AgentRole> roles) {
        return roles.stream().map(AgentRole::key).collect(Collectors.joining(", "));
    }
}
