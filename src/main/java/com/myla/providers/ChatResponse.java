package com.myla.providers;

import java.util.List;
import java.util.Map;

public record ChatResponse(
    String model,
    String content,
    Map<String, Integer> usage,
    List<ToolCallInfo> toolCalls,
    String stopReason
) {
    public ChatResponse(String content, Map<String, Integer> usage) {
        this(null, content, usage, List.of(), "end_turn");
    }

    public ChatResponse(String content, Map<String, Integer> usage, List<ToolCallInfo> toolCalls) {
        this(null, content, usage, toolCalls, toolCalls.isEmpty() ? "end_turn" : "tool_use");
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
