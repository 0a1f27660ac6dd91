package com.myla.agent;

public enum LoopState {
    AWAITING_MODEL,
    AWAITING_TOOL_RESULTS,
    DONE,
    ITERATION_EXCEEDED,
    ERRORED;

    public boolean isTerminal() {
        return this == DONE || this == ITERATION_EXCEEDED || this == ERRORED;
    }
}
