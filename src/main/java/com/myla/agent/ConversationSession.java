package com.myla.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turn history of one orchestration run plus its iteration budget.
 */
public class ConversationSession {

    private final List<Map<String, Object>> messages = new ArrayList<>();
    private final int maxIterations;
    private int iteration;

    public ConversationSession(int maxIterations) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive");
        this.maxIterations = maxIterations;
    }

    public void add(Map<String, Object> message) {
        messages.add(message);
    }

    public List<Map<String, Object>> messages() {
        return List.copyOf(messages);
    }

    public int iteration() { return iteration; }
    public int maxIterations() { return maxIterations; }

    public boolean hasIterationsLeft() {
        return iteration < maxIterations;
    }

    int nextIteration() {
        if (!hasIterationsLeft()) {
            throw new IllegalStateException("Iteration budget of " + maxIterations + " exhausted");
        }
        return ++iteration;
    }
}
