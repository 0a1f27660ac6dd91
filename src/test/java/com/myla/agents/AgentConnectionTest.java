package com.myla.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.tools.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentConnectionTest {

    private final AgentChannel channel = new AgentChannel() {
        @Override public List<OperationDef> listOperations() { return List.of(); }
        @Override public ToolResult invoke(String operation, JsonNode arguments) { return ToolResult.ok(""); }
        @Override public void close() { }
    };

    @Test
    void followsConnectLifecycle() {
        var connection = new AgentConnection("jira-agent", List.of("tasks"));
        assertEquals(ConnectionState.DISCONNECTED, connection.state());

        connection.connecting();
        assertTrue(connection.channel().isEmpty());
        connection.ready(channel);
        assertTrue(connection.isReady());
        assertSame(channel, connection.channel().orElseThrow());

        assertSame(channel, connection.disconnect());
        assertEquals(ConnectionState.DISCONNECTED, connection.state());
        assertNull(connection.disconnect());
    }

    @Test
    void neverReturnsToConnectingOnceReady() {
        var connection = new AgentConnection("jira-agent", List.of());
        connection.connecting();
        connection.ready(channel);

        assertThrows(IllegalStateException.class, connection::connecting);
        assertThrows(IllegalStateException.class, () -> connection.fail("late"));
        assertFalse(connection.failIfConnecting("late"));
        assertTrue(connection.isReady());
    }

    @Test
    void failedConnectionCanOnlyBeTornDown() {
        var connection = new AgentConnection("jira-agent", List.of());
        connection.connecting();
        connection.fail("boom");

        assertThrows(IllegalStateException.class, () -> connection.ready(channel));
        assertEquals("boom", connection.failureReason());
        assertNull(connection.disconnect());
        assertEquals(ConnectionState.DISCONNECTED, connection.state());
    }

    @Test
    void transitionTable() {
        assertTrue(ConnectionState.DISCONNECTED.canTransitionTo(ConnectionState.CONNECTING));
        assertFalse(ConnectionState.DISCONNECTED.canTransitionTo(ConnectionState.READY));
        assertFalse(ConnectionState.READY.canTransitionTo(ConnectionState.CONNECTING));
        assertTrue(ConnectionState.FAILED.canTransitionTo(ConnectionState.DISCONNECTED));
    }
}
