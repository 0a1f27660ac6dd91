package com.myla.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.observability.MetricsConfig;
import com.myla.shared.config.AgentSpec;
import com.myla.tools.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AgentConnectorTest {

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final MetricsConfig metrics = new MetricsConfig();
    private Path launchable;

    @BeforeEach
    void setUp() throws Exception {
        launchable = Files.createFile(tempDir.resolve("agent-server"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void missingLaunchTargetFailsOnlyThatAgent() throws Exception {
        var script = Files.createFile(tempDir.resolve("jira_server.py"));
        var connector = new AgentConnector(spec -> new StubChannel(), executor, 1000, metrics);
        var agents = new LinkedHashMap<String, AgentSpec>();
        agents.put("github-agent", new AgentSpec("github-agent", launchable.toString(),
            List.of(tempDir.resolve("missing_server.py").toString())));
        agents.put("jira-agent", new AgentSpec("jira-agent", launchable.toString(), List.of(script.toString())));
        agents.put("docs-agent", new AgentSpec("docs-agent", tempDir.resolve("no-such-binary").toString(), List.of()));

        var connections = connector.initializeAll(agents);

        assertEquals(ConnectionState.FAILED, connections.get(0).state());
        assertTrue(connections.get(0).failureReason().contains("not found"));
        assertEquals(ConnectionState.READY, connections.get(1).state());
        assertEquals(ConnectionState.FAILED, connections.get(2).state());
        assertEquals(List.of("jira-agent"), connector.readyAgentIds());
        assertEquals(1.0, metrics.agentConnections("ready").count());
        assertEquals(2.0, metrics.agentConnections("failed").count());
    }

    @Test
    void launchErrorIsReportedAsFailure() {
        var connector = new AgentConnector(spec -> { throw new java.io.IOException("handshake refused"); },
            executor, 1000, metrics);

        var connection = connector.connect("github-agent", new AgentSpec("github-agent", launchable.toString(), List.of()));

        assertEquals(ConnectionState.FAILED, connection.state());
        assertEquals("handshake refused", connection.failureReason());
        assertFalse(connector.isReady("github-agent"));
    }

    @Test
    void timeoutFailsAndReleasesLateChannel() throws Exception {
        var release = new AtomicBoolean();
        var late = new StubChannel();
        var connector = new AgentConnector(spec -> {
            while (!release.get()) Thread.onSpinWait();
            return late;
        }, executor, 100, metrics);

        var connection = connector.connect("slow-agent", new AgentSpec("slow-agent", launchable.toString(), List.of()));

        assertEquals(ConnectionState.FAILED, connection.state());
        assertTrue(connection.failureReason().contains("timed out"));
        release.set(true);
        assertTrue(late.closed.await(2, TimeUnit.SECONDS), "late channel must be closed");
        assertTrue(connection.channel().isEmpty());
    }

    @Test
    void disconnectAllClosesEveryChannelDespiteErrors() {
        var connector = new AgentConnector(spec -> new StubChannel(), executor, 1000, metrics);
        var first = new StubChannel();
        var broken = new StubChannel() {
            @Override public void close() {
                super.close();
                throw new IllegalStateException("already gone");
            }
        };
        var last = new StubChannel();
        var c1 = connector.registerLocal("a-agent", first, List.of());
        connector.registerLocal("b-agent", broken, List.of());
        connector.registerLocal("c-agent", last, List.of());

        connector.disconnectAll();

        assertEquals(0, first.closed.getCount());
        assertEquals(0, broken.closed.getCount());
        assertEquals(0, last.closed.getCount());
        assertTrue(connector.connections().isEmpty());
        assertEquals(ConnectionState.DISCONNECTED, c1.state());
    }

    @Test
    void registerLocalRejectsSecondLiveRegistration() {
        var connector = new AgentConnector(spec -> new StubChannel(), executor, 1000, metrics);
        connector.registerLocal("inter-agent-coordinator", new StubChannel(), List.of("coordination"));

        assertThrows(IllegalStateException.class,
            () -> connector.registerLocal("inter-agent-coordinator", new StubChannel(), List.of()));
        assertTrue(connector.channel("inter-agent-coordinator").isPresent());
    }

    static class StubChannel implements AgentChannel {
        final CountDownLatch closed = new CountDownLatch(1);

        @Override public List<OperationDef> listOperations() { return List.of(); }
        @Override public ToolResult invoke(String operation, JsonNode arguments) { return ToolResult.ok("ok"); }
        @Override public void close() { closed.countDown(); }
    }
}
