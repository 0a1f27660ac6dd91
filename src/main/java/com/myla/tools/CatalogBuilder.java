package com.myla.tools;

import com.myla.agents.AgentChannel;
import com.myla.agents.AgentConnector;
import com.myla.agents.OperationDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lists the operations of the relevant, connected agents and merges them into one namespaced catalog.
 * Agents that fail to list their tools are left out.
 */
public class CatalogBuilder {

    private static final Logger log = LoggerFactory.getLogger(CatalogBuilder.class);

    private final AgentConnector connector;
    private final ExecutorService executor;
    private final long listTimeoutMillis;

    public CatalogBuilder(AgentConnector connector, ExecutorService executor, long listTimeoutMillis) {
        this.connector = connector;
        this.executor = executor;
        this.listTimeoutMillis = listTimeoutMillis;
    }

    /**
     * @throws CatalogException if none of the agents contributed a tool
     */
    public ToolCatalog build(List<String> agentIds) {
        var listings = new LinkedHashMap<String, CompletableFuture<List<OperationDef>>>();
        var channels = new LinkedHashMap<String, AgentChannel>();
        for (var agentId : agentIds) {
            if (listings.containsKey(agentId)) continue;
            if (agentId.contains(ToolNames.SEPARATOR)) {
                log.error("Agent id {} contains '{}', its tools cannot be namespaced", agentId, ToolNames.SEPARATOR);
                continue;
            }
            var channel = connector.channel(agentId);
            if (channel.isEmpty()) {
                log.debug("Agent {} is not connected, skipping", agentId);
                continue;
            }
            channels.put(agentId, channel.get());
            listings.put(agentId, listAsync(agentId, channel.get()));
        }

        var catalog = new ToolCatalog();
        for (Map.Entry<String, CompletableFuture<List<OperationDef>>> entry : listings.entrySet()) {
            var agentId = entry.getKey();
            for (var op : entry.getValue().join()) {
                var descriptor = toDescriptor(agentId, op);
                if (descriptor == null) continue;
                if (catalog.contains(descriptor.key())) {
                    log.warn("Agent {} lists tool {} twice, keeping the first", agentId, op.name());
                    continue;
                }
                catalog.register(descriptor, new AgentToolBridge(channels.get(agentId), descriptor));
            }
        }
        if (catalog.isEmpty()) {
            throw new CatalogException("No tools available from agents " + agentIds);
        }
        log.info("Catalog built with {} tools from {}", catalog.size(), catalog.agentIds());
        return catalog;
    }

    private CompletableFuture<List<OperationDef>> listAsync(String agentId, AgentChannel channel) {
        return CompletableFuture.supplyAsync(() -> {
                try {
                    return channel.listOperations();
                } catch (Exception e) {
                    throw new CatalogException("listing tools of " + agentId + " failed: " + e.getMessage());
                }
            }, executor)
            .orTimeout(listTimeoutMillis, TimeUnit.MILLISECONDS)
            .exceptionally(e -> {
                log.error("Error getting tools from {}: {}", agentId, rootMessage(e));
                return List.of();
            });
    }

    static ToolDescriptor toDescriptor(String agentId, OperationDef op) {
        if (!ToolNames.isValidToolName(op.name())) {
            log.warn("Agent {} exposes invalid tool name '{}', skipping", agentId, op.name());
            return null;
        }
        if (!ToolNames.isAcceptedByModel(agentId, op.name())) {
            log.warn("Tool {}{}{} is not a valid model tool name, skipping", agentId, ToolNames.SEPARATOR, op.name());
            return null;
        }
        return new ToolDescriptor(agentId, op.name(), op.description(), op.inputSchema());
    }

    private static String rootMessage(Throwable t) {
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
