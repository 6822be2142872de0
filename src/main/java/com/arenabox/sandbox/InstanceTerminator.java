package com.arenabox.sandbox;

import com.arenabox.core.metrics.SandboxMetrics;
import com.arenabox.core.model.Instance;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.persistence.InstanceTracker;
import com.arenabox.transport.OrchestratorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The one teardown path shared by solve, revert, staleness and administrative kills: remove the
 * sandbox on the orchestrator, then forget the record. A failed removal keeps the record so a later
 * attempt can retry it.
 */
@Component
public class InstanceTerminator {

    private static final Logger log = LoggerFactory.getLogger(InstanceTerminator.class);

    private final SandboxProviders providers;
    private final InstanceTracker tracker;
    private final SandboxMetrics metrics;

    public InstanceTerminator(SandboxProviders providers, InstanceTracker tracker, SandboxMetrics metrics) {
        this.providers = providers;
        this.tracker = tracker;
        this.metrics = metrics;
    }

    public OrchestratorResult<Boolean> terminate(OrchestratorConfig config, Instance instance, String reason) {
        OrchestratorResult<Boolean> result = providers.forKind(instance.kind())
                .teardownSandbox(config, instance.handle());
        metrics.recordTeardown(reason, result.isSuccess());
        if (!result.isSuccess()) {
            log.warn("Teardown ({}) of {} [{}] failed: {}", reason, instance.key(), instance.handle(), result.error());
            return result;
        }
        tracker.delete(instance.key());
        log.info("Instance {} [{}] torn down ({})", instance.key(), instance.handle(), reason);
        return result;
    }
}
