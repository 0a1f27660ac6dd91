package com.myla.agent;

/**
 * Outcome of one loop run: the terminal state, the text to hand back and how many model calls it took.
 */
public record LoopResult(
    LoopState state,
    String text,
    int iterations,
    int toolCalls
) {}
