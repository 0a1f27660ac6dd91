package com.myla.tools;

/**
 * Per-call context handed to a tool: the conversation it runs in and the model's call id.
 */
public record ToolContext(String sessionId, String callId) {

    public static ToolContext none() {
        return new ToolContext("", "");
    }
}
