package com.myla.shared.config;

import java.util.List;

public record OrchestratorSettings(
    int maxIterations,
    long connectTimeoutSeconds,
    long requestTimeoutSeconds,
    List<String> defaultAgents,
    String coordinatorId,
    long unreadWindowHours,
    double temperature,
    int maxTokens
) {
    public static final String COORDINATOR_ID = "inter-agent-coordinator";

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(10, 30, 30,
            List.of("github-agent", "jira-agent"), COORDINATOR_ID, 24, 0.7, 4096);
    }
}
