package com.myla.agents;

import java.util.List;
import java.util.Optional;

public class AgentConnection {

    private final String agentId;
    private final List<String> capabilities;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private AgentChannel channel;
    private String failureReason;

    public AgentConnection(String agentId, List<String> capabilities) {
        this.agentId = agentId;
        this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
    }

    public String agentId() { return agentId; }
    public List<String> capabilities() { return capabilities; }
    public synchronized ConnectionState state() { return state; }
    public synchronized String failureReason() { return failureReason; }
    public synchronized boolean isReady() { return state == ConnectionState.READY; }

    public synchronized Optional<AgentChannel> channel() {
        return state == ConnectionState.READY ? Optional.of(channel) : Optional.empty();
    }

    synchronized void connecting() {
        transitionTo(ConnectionState.CONNECTING);
    }

    synchronized void ready(AgentChannel channel) {
        transitionTo(ConnectionState.READY);
        this.channel = channel;
    }

    synchronized void fail(String reason) {
        transitionTo(ConnectionState.FAILED);
        this.failureReason = reason;
    }

    /** Fails the attempt unless a concurrent shutdown already moved the connection on. */
    synchronized boolean failIfConnecting(String reason) {
        if (state != ConnectionState.CONNECTING) return false;
        fail(reason);
        return true;
    }

    /** Moves to DISCONNECTED and hands back the channel that still needs closing, if any. */
    synchronized AgentChannel disconnect() {
        if (state == ConnectionState.DISCONNECTED) return null;
        if (state == ConnectionState.CONNECTING) {
            fail("shut down while connecting");
        }
        transitionTo(ConnectionState.DISCONNECTED);
        var live = channel;
        channel = null;
        return live;
    }

    private void transitionTo(ConnectionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Agent " + agentId + ": illegal transition " + state + " -> " + next);
        }
        state = next;
    }

    @Override
    public synchronized String toString() {
        return agentId + "[" + state + (failureReason != null ? ": " + failureReason : "") + "]";
    }
}
