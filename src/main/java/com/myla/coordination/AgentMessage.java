package com.myla.coordination;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AgentMessage(
    String id,
    AgentRole from,
    AgentRole to,
    MessageType type,
    String content,
    Map<String, Object> metadata,
    Instant timestamp,
    boolean requiresResponse,
    String parentMessageId
) {
    public AgentMessage {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
