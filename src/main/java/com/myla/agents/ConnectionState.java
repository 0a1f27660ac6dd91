package com.myla.agents;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY,
    FAILED;

    public boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case DISCONNECTED -> next == CONNECTING;
            case CONNECTING -> next == READY || next == FAILED;
            case READY, FAILED -> next == DISCONNECTED;
        };
    }
}
