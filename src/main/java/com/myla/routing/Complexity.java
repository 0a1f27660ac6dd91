package com.myla.routing;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    static Complexity of(int relevantAgents) {
        if (relevantAgents > 2) return HIGH;
        return relevantAgents > 1 ? MEDIUM : LOW;
    }

    public String label() {
        return name().toLowerCase();
    }
}
