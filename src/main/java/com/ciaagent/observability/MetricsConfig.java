package com.ciaagent.observability;

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

    public Timer connectLatency() {
        return Timer.builder("cia.mcp.connect.latency").register(registry);
    }

    public Counter connectFailures() {
        return Counter.builder("cia.mcp.connect.failures").register(registry);
    }

    public Counter toolExecutions() {
        return Counter.builder("cia.mcp.tool.executions").register(registry);
    }

    public Counter providerRetries() {
        return Counter.builder("cia.provider.retries").register(registry);
    }
}
