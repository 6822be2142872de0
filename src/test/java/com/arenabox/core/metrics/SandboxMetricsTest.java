package com.arenabox.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SandboxMetricsTest {

    private SimpleMeterRegistry registry;
    private SandboxMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SandboxMetrics(registry);
    }

    @Test
    void provisionCountersAreTaggedByKindAndResult() {
        metrics.recordProvision("SINGLE", true);
        metrics.recordProvision("SINGLE", true);
        metrics.recordProvision("MULTI_PART", false);

        assertEquals(2.0, registry.get("arenabox.sandbox.provisions")
                .tag("kind", "SINGLE").tag("result", "success").counter().count());
        assertEquals(1.0, registry.get("arenabox.sandbox.provisions")
                .tag("kind", "MULTI_PART").tag("result", "failure").counter().count());
    }

    @Test
    void teardownsAreTaggedByReason() {
        metrics.recordTeardown("stale", true);
        metrics.recordTeardown("solve", false);

        assertEquals(1.0, registry.get("arenabox.sandbox.teardowns").tag("reason", "stale").counter().count());
        assertEquals(1.0, registry.get("arenabox.sandbox.teardowns")
                .tag("reason", "solve").tag("result", "failure").counter().count());
    }

    @Test
    void portAllocationsAreSummarised() {
        metrics.recordPortsAllocated(2);
        metrics.recordPortsAllocated(4);

        var summary = registry.get("arenabox.ports.allocated").summary();
        assertEquals(2, summary.count());
        assertEquals(6.0, summary.totalAmount());
    }
}
