package com.myla.agents;

public class AgentConnectionException extends RuntimeException {

    public AgentConnectionException(String message) {
        super(message);
    }

    public AgentConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
