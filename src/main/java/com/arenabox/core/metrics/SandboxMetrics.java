package com.arenabox.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for sandbox lifecycle and secret handling.
 */
@Service
public class SandboxMetrics {

    private final MeterRegistry registry;

    public SandboxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProvision(String kind, boolean success) {
        Counter.builder("arenabox.sandbox.provisions")
                .tag("kind", kind)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * @param reason "stale", "solve", "revert", "admin" or "challenge-deleted"
     */
    public void recordTeardown(String reason, boolean success) {
        Counter.builder("arenabox.sandbox.teardowns")
                .description("Sandbox teardowns by trigger")
                .tag("reason", reason)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * @param result "success", "rejected" or "failure"
     */
    public void recordRevert(String result) {
        Counter.builder("arenabox.sandbox.reverts")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordPortsAllocated(int count) {
        DistributionSummary.builder("arenabox.ports.allocated")
                .description("Ports allocated per provisioning")
                .register(registry)
                .record(count);
    }

    public void recordSecretOperation(String operation, boolean success) {
        Counter.builder("arenabox.secrets.operations")
                .tag("operation", operation)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
