package com.myla.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer llmLatency() {
        return Timer.builder("myla.llm.latency").register(registry);
    }

    public Counter llmCalls() {
        return Counter.builder("myla.llm.calls").register(registry);
    }

    public Counter toolInvocations() {
        return Counter.builder("myla.tool.invocations").register(registry);
    }

    public Counter toolFailures() {
        return Counter.builder("myla.tool.failures").register(registry);
    }

    public Counter agentConnections(String outcome) {
        return Counter.builder("myla.agent.connections").tag("outcome", outcome).register(registry);
    }
}
