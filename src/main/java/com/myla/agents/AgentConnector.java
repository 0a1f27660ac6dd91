package com.myla.agents;

import com.myla.observability.MetricsConfig;
import com.myla.shared.config.AgentSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the connection to every configured agent: launch-target validation, connect timeout,
 * and teardown. One agent failing never affects the others.
 * <p>
 * Attempts run on the given executor, which must not be bounded: {@link #initializeAll} waits
 * on attempts that themselves submit the launch.
 */
public class AgentConnector implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(AgentConnector.class);

    private final ChannelLauncher launcher;
    private final ExecutorService executor;
    private final long connectTimeoutMillis;
    private final MetricsConfig metrics;
    private final Map<String, AgentConnection> connections = new LinkedHashMap<>();

    public AgentConnector(ChannelLauncher launcher, ExecutorService executor,
                          long connectTimeoutMillis, MetricsConfig metrics) {
        this.launcher = launcher;
        this.executor = executor;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.metrics = metrics;
    }

    /**
     * Connects every configured agent concurrently and waits for all attempts.
     */
    public List<AgentConnection> initializeAll(Map<String, AgentSpec> agents) {
        log.info("Initializing agent connections...");
        var attempts = new ArrayList<CompletableFuture<AgentConnection>>();
        for (var entry : agents.entrySet()) {
            attempts.add(CompletableFuture.supplyAsync(
                () -> connect(entry.getKey(), entry.getValue()), executor));
        }
        var result = attempts.stream().map(CompletableFuture::join).toList();

        var ready = readyAgentIds();
        if (ready.isEmpty()) {
            log.warn("No agents connected successfully");
        } else {
            log.info("Connected to {} agents: {}", ready.size(), ready);
        }
        return result;
    }

    /**
     * Connects one agent. Never throws: failures are reported through the returned
     * connection's FAILED state, and any channel the attempt opened is closed.
     */
    public AgentConnection connect(String agentId, AgentSpec spec) {
        var connection = new AgentConnection(agentId, spec.capabilities());
        synchronized (this) {
            var existing = connections.get(agentId);
            if (existing != null && existing.isReady()) {
                log.warn("Agent {} is already connected", agentId);
                return existing;
            }
            connections.put(agentId, connection);
        }
        connection.connecting();

        try {
            LaunchTargets.validate(spec);
        } catch (AgentConnectionException e) {
            log.error("Cannot launch {}: {}", agentId, e.getMessage());
            return failed(connection, e.getMessage());
        }

        log.info("Connecting to {}...", agentId);
        var abandoned = new AtomicBoolean();
        Future<AgentChannel> attempt = executor.submit(() -> {
            var channel = launcher.launch(spec);
            if (abandoned.get()) {
                closeQuietly(agentId, channel);
                throw new CancellationException("connection attempt abandoned");
            }
            return channel;
        });

        try {
            var channel = attempt.get(connectTimeoutMillis, TimeUnit.MILLISECONDS);
            connection.ready(channel);
            if (!isRegistered(connection)) {
                log.warn("Agent {} was disconnected while connecting", agentId);
                closeQuietly(agentId, connection.disconnect());
                return connection;
            }
            metrics.agentConnections("ready").increment();
            log.info("Connected to {}", agentId);
            return connection;
        } catch (TimeoutException e) {
            log.error("Timeout connecting to {} ({}ms)", agentId, connectTimeoutMillis);
            abandon(agentId, attempt, abandoned);
            return failed(connection, "timed out after " + connectTimeoutMillis + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(agentId, attempt, abandoned);
            return failed(connection, "interrupted");
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to connect to {}: {}", agentId, cause.getMessage());
            return failed(connection, String.valueOf(cause.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to connect to {}: {}", agentId, e.getMessage());
            abandon(agentId, attempt, abandoned);
            return failed(connection, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Registers an in-process agent, which is ready as soon as it exists.
     */
    public synchronized AgentConnection registerLocal(String agentId, AgentChannel channel, List<String> capabilities) {
        var existing = connections.get(agentId);
        if (existing != null && existing.isReady()) {
            throw new IllegalStateException("Agent already connected: " + agentId);
        }
        var connection = new AgentConnection(agentId, capabilities);
        connection.connecting();
        connection.ready(channel);
        connections.put(agentId, connection);
        metrics.agentConnections("ready").increment();
        log.info("Registered local agent {}", agentId);
        return connection;
    }

    public synchronized Optional<AgentChannel> channel(String agentId) {
        var connection = connections.get(agentId);
        return connection != null ? connection.channel() : Optional.empty();
    }

    public synchronized boolean isReady(String agentId) {
        var connection = connections.get(agentId);
        return connection != null && connection.isReady();
    }

    public synchronized List<String> readyAgentIds() {
        return connections.values().stream()
            .filter(AgentConnection::isReady)
            .map(AgentConnection::agentId)
            .toList();
    }

    public synchronized List<AgentConnection> connections() {
        return List.copyOf(connections.values());
    }

    /**
     * Closes every live channel, continuing past individual close errors, then empties the registry.
     */
    public void disconnectAll() {
        List<AgentConnection> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(connections.values());
            connections.clear();
        }
        if (snapshot.isEmpty()) return;
        log.info("Closing agent connections...");
        for (var connection : snapshot) {
            try {
                var channel = connection.disconnect();
                if (channel != null) channel.close();
            } catch (Exception e) {
                log.error("Error closing connection to {}: {}", connection.agentId(), e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        disconnectAll();
    }

    private synchronized boolean isRegistered(AgentConnection connection) {
        return connections.get(connection.agentId()) == connection;
    }

    private AgentConnection failed(AgentConnection connection, String reason) {
        if (!connection.failIfConnecting(reason)) {
            log.debug("Agent {} left CONNECTING before failing: {}", connection.agentId(), reason);
        }
        metrics.agentConnections("failed").increment();
        return connection;
    }

    /**
     * Cancels an in-flight attempt. If it already produced a channel, that channel is closed here;
     * if it produces one later, the attempt closes it itself.
     */
    private void abandon(String agentId, Future<AgentChannel> attempt, AtomicBoolean abandoned) {
        abandoned.set(true);
        if (attempt.cancel(true) || !attempt.isDone()) return;
        try {
            closeQuietly(agentId, attempt.get());
        } catch (ExecutionException | CancellationException e) {
            log.debug("Abandoned attempt for {} ended without a channel: {}", agentId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(String agentId, AgentChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (RuntimeException e) {
            log.error("Error during cleanup for {}: {}", agentId, e.getMessage());
        }
    }
}
