package com.myla.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.agents.AgentChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts one operation of a connected agent into the Tool interface.
 */
public class AgentToolBridge implements Tool {

    private static final Logger log = LoggerFactory.getLogger(AgentToolBridge.class);

    private final AgentChannel channel;
    private final ToolDescriptor descriptor;

    public AgentToolBridge(AgentChannel channel, ToolDescriptor descriptor) {
        this.channel = channel;
        this.descriptor = descriptor;
    }

    @Override public String name() { return descriptor.qualifiedName(); }
    @Override public String description() { return "[" + descriptor.agentId() + "] " + descriptor.description(); }
    @Override public JsonNode inputSchema() { return descriptor.inputSchema(); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        log.info("Calling {} on {} (call {})", descriptor.name(), descriptor.agentId(), ctx.callId());
        try {
            return channel.invoke(descriptor.name(), input);
        } catch (Exception e) {
            log.error("Error calling {} on {}: {}", descriptor.name(), descriptor.agentId(), e.getMessage());
            return ToolResult.error("Error: " + e.getMessage());
        }
    }
}
