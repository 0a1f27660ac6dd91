package com.myla.shared.model;

import java.util.List;

public record AgentRequest(
    String sessionId,
    String message,
    List<ThreadMessage> context
) {}
