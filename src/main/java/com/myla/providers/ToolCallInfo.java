package com.myla.providers;

/**
 * One tool call requested by the model. {@code arguments} is the raw JSON object text.
 */
public record ToolCallInfo(String id, String name, String arguments) {}
