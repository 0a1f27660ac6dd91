package com.myla.agents;

import com.myla.shared.config.AgentSpec;

import java.io.IOException;

/**
 * Opens a channel to a configured agent. The returned channel is fully initialized;
 * on failure nothing acquired by the attempt may stay open.
 */
@FunctionalInterface
public interface ChannelLauncher {
    AgentChannel launch(AgentSpec spec) throws IOException;
}
