package com.myla.providers;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral request. Messages and tools use the OpenAI chat-completions shape;
 * providers with another wire format translate.
 */
public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    double temperature,
    List<Map<String, Object>> tools,
    int maxTokens
) {
    public ChatRequest(String model, List<Map<String, Object>> messages, double temperature) {
        this(model, messages, temperature, null, 4096);
    }
}
