package com.myla.providers;

public interface ModelProvider {
    String id();
    ChatResponse chat(ChatRequest request);
}
