package com.myla.shared.model;

/**
 * One earlier message of the conversation thread a query was posted in.
 */
public record ThreadMessage(
    String user,
    String text
) {}
