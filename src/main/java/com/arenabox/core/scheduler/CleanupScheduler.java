package com.arenabox.core.scheduler;

import com.arenabox.core.model.Instance;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.Participant;
import com.arenabox.core.persistence.InstanceTracker;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import com.arenabox.sandbox.InstanceTerminator;
import com.arenabox.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reclaims instances older than the staleness threshold.
 *
 * <p>{@link #reclaimStale} runs inline before every provisioning request and only looks at the
 * requester's own instances. {@link #sweep} is an optional periodic pass over all instances, active
 * when scheduling is enabled with {@code arenabox.sandbox.sweep-enabled=true}.
 */
@Component
public class CleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

    private static final String REASON = "stale";

    private final InstanceTracker tracker;
    private final InstanceTerminator terminator;
    private final OrchestratorConfigStore configStore;
    private final SandboxProperties properties;
    private final Clock clock;

    public CleanupScheduler(InstanceTracker tracker, InstanceTerminator terminator,
                            OrchestratorConfigStore configStore, SandboxProperties properties, Clock clock) {
        this.tracker = tracker;
        this.terminator = terminator;
        this.configStore = configStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Tears down the participant's stale instances. Failures are logged and skipped.
     *
     * @return number of instances removed
     */
    public int reclaimStale(OrchestratorConfig config, Participant participant) {
        List<Instance> stale = tracker.findStale(participant, cutoff());
        int removed = 0;
        for (Instance instance : stale) {
            if (terminator.terminate(config, instance, REASON).isSuccess()) {
                removed++;
            }
        }
        if (!stale.isEmpty()) {
            log.info("Reclaimed {}/{} stale instance(s) of {}", removed, stale.size(), participant.key());
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${arenabox.sandbox.sweep-interval:PT10M}",
            initialDelayString = "${arenabox.sandbox.sweep-interval:PT10M}")
    public void sweep() {
        Optional<OrchestratorConfig> config = configStore.get().filter(OrchestratorConfig::isConfigured);
        if (config.isEmpty()) {
            log.debug("Skipping stale sweep, orchestrator not configured");
            return;
        }
        int removed = sweep(config.get());
        if (removed > 0) {
            log.info("Stale sweep removed {} instance(s)", removed);
        }
    }

    /**
     * System-wide pass in keyset pages of {@code kill-batch-size}.
     */
    public int sweep(OrchestratorConfig config) {
        Instant cutoff = cutoff();
        int batchSize = properties.getKillBatchSize();
        long afterId = 0;
        int removed = 0;
        while (true) {
            List<Instance> batch = tracker.findStaleBatch(cutoff, afterId, batchSize);
            for (Instance instance : batch) {
                if (terminator.terminate(config, instance, REASON).isSuccess()) {
                    removed++;
                }
            }
            if (batch.size() < batchSize) {
                return removed;
            }
            afterId = batch.get(batch.size() - 1).id();
        }
    }

    private Instant cutoff() {
        return clock.instant().minus(properties.getStaleAfter());
    }
}
