package com.myla.coordination;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum MessageType {
    REQUEST("request"),
    RESPONSE("response"),
    NOTIFICATION("notification"),
    TASK_ASSIGNMENT("task_assignment"),
    STATUS_UPDATE("status_update");

    private final String key;

    MessageType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() { return key; }

    public static MessageType fromKey(String key) {
        for (var type : values()) {
            if (type.key.equals(key)) return type;
        }
        throw new IllegalArgumentException("Unknown message type '" + key + "', expected one of "
            + Arrays.stream(values()).map(MessageType::key).collect(Collectors.joining(", ")));
    }
}
