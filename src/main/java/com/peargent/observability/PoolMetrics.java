package com.peargent.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class PoolMetrics {

    private final MeterRegistry registry;

    public PoolMetrics() {
        this(new SimpleMeterRegistry());
    }

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter agentTurns() {
        return Counter.builder("peargent.agent.turns").register(registry);
    }

    public Counter routerStops() {
        return Counter.builder("peargent.router.stops").register(registry);
    }

    public Counter toolInvocations() {
        return Counter.builder("peargent.tool.invocations").register(registry);
    }

    public Counter toolRetries() {
        return Counter.builder("peargent.tool.retries").register(registry);
    }

    public Counter toolFailures() {
        return Counter.builder("peargent.tool.failures").register(registry);
    }

    public Timer modelLatency() {
        return Timer.builder("peargent.model.latency").register(registry);
    }
}
