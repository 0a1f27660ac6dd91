package com.myla.coordination;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String key;

    TaskStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() { return key; }

    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public static TaskStatus fromKey(String key) {
        for (var status : values()) {
            if (status.key.equals(key)) return status;
        }
        throw new IllegalArgumentException("Unknown task status '" + key + "', expected one of "
            + Arrays.stream(values()).map(TaskStatus::key).collect(Collectors.joining(", ")));
    }
}
