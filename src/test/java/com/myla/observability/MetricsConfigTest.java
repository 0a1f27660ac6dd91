package com.myla.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsConfigTest {

    @Test
    void metersShareNamesAcrossLookups() {
        var config = new MetricsConfig();
        config.toolInvocations().increment();
        config.toolInvocations().increment();
        config.toolFailures().increment();

        assertEquals(2.0, config.toolInvocations().count());
        assertEquals(1.0, config.toolFailures().count());
        assertNotNull(config.llmLatency());
    }

    @Test
    void connectionOutcomesAreTagged() {
        var registry = new SimpleMeterRegistry();
        var config = new MetricsConfig(registry);
        config.agentConnections("ready").increment();
        config.agentConnections("failed").increment();
        config.agentConnections("failed").increment();

        assertEquals(1.0, registry.get("myla.agent.connections").tag("outcome", "ready").counter().count());
        assertEquals(2.0, registry.get("myla.agent.connections").tag("outcome", "failed").counter().count());
    }
}
