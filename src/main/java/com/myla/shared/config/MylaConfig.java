package com.myla.shared.config;

import java.util.List;
import java.util.Map;

public record MylaConfig(
    int serverPort,
    String primaryProvider,
    String model,
    List<String> fallbackProviders,
    Map<String, String> apiKeys,
    Map<String, AgentSpec> agents,
    Map<String, List<String>> routing,
    OrchestratorSettings orchestrator
) {}
