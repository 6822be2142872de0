package com.arenabox.sandbox;

import com.arenabox.core.error.ConflictException;
import com.arenabox.core.error.NotFoundException;
import com.arenabox.core.error.TransportException;
import com.arenabox.core.error.ValidationException;
import com.arenabox.core.logging.MdcContext;
import com.arenabox.core.metrics.SandboxMetrics;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.ChallengeDefinition;
import com.arenabox.core.model.Instance;
import com.arenabox.core.model.InstanceKey;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.model.ResolvedSecret;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.core.persistence.ChallengeStore;
import com.arenabox.core.persistence.InstanceTracker;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import com.arenabox.core.scheduler.CleanupScheduler;
import com.arenabox.core.validation.InputValidator;
import com.arenabox.secrets.SecretVault;
import com.arenabox.transport.OrchestratorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of participant sandboxes: provision-or-fetch, revert, solve-triggered teardown and
 * administrative kills.
 *
 * <p>Both sandbox kinds go through the same flow; only the {@link SandboxProvider} picked for the
 * challenge's kind differs. Every operation reads the orchestrator configuration fresh.
 *
 * <p>No lock is taken before the creation call. Two concurrent requests for the same key can both
 * reach the orchestrator; the tracker's unique key lets exactly one record win, and the loser's sandbox
 * is torn down again unless the orchestrator handed both the same one.
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final OrchestratorConfigStore configStore;
    private final ChallengeStore challengeStore;
    private final InstanceTracker tracker;
    private final OrchestratorInventory inventory;
    private final PortAllocator portAllocator;
    private final SandboxProviders providers;
    private final InstanceTerminator terminator;
    private final CleanupScheduler cleanupScheduler;
    private final SecretVault secretVault;
    private final SandboxProperties properties;
    private final SandboxMetrics metrics;
    private final Clock clock;

    public SandboxManager(OrchestratorConfigStore configStore, ChallengeStore challengeStore,
                          InstanceTracker tracker, OrchestratorInventory inventory, PortAllocator portAllocator,
                          SandboxProviders providers, InstanceTerminator terminator,
                          CleanupScheduler cleanupScheduler, SecretVault secretVault,
                          SandboxProperties properties, SandboxMetrics metrics, Clock clock) {
        this.configStore = configStore;
        this.challengeStore = challengeStore;
        this.tracker = tracker;
        this.inventory = inventory;
        this.portAllocator = portAllocator;
        this.providers = providers;
        this.terminator = terminator;
        this.cleanupScheduler = cleanupScheduler;
        this.secretVault = secretVault;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Result of a provision-or-fetch call.
     *
     * @param instance the participant's active instance
     * @param created  true if this call created it, false if it already existed
     */
    public record ProvisionOutcome(Instance instance, boolean created) {}

    /**
     * Returns the participant's active instance for the challenge, creating one if there is none.
     * The participant's stale instances are reclaimed first.
     */
    public ProvisionOutcome provision(Participant participant, long challengeId) {
        ChallengeDefinition challenge = requireChallenge(challengeId);
        MdcContext.setInstance(participant, challengeId, challenge.kind());
        try {
            OrchestratorConfig config = configStore.require();
            checkImageAllowed(config, challenge.image());

            cleanupScheduler.reclaimStale(config, participant);

            Optional<Instance> existing = tracker.find(keyOf(participant, challenge));
            if (existing.isPresent()) {
                log.info("Returning existing instance {}", existing.get().handle());
                return new ProvisionOutcome(existing.get(), false);
            }
            return create(config, participant, challenge);
        } finally {
            MdcContext.clear();
        }
    }

    public List<Instance> list(Participant participant) {
        return tracker.findByParticipant(participant);
    }

    /**
     * Destroys the participant's instance and creates a fresh one.
     *
     * @throws ConflictException if the revert cooldown has not elapsed
     */
    public ProvisionOutcome revert(Participant participant, long challengeId) {
        ChallengeDefinition challenge = requireChallenge(challengeId);
        MdcContext.setInstance(participant, challengeId, challenge.kind());
        try {
            Instance current = tracker.find(keyOf(participant, challenge))
                    .orElseThrow(() -> new NotFoundException("No active instance of challenge " + challengeId
                            + " for " + participant.key()));

            Instant now = now();
            if (!current.isRevertEligible(now)) {
                metrics.recordRevert("rejected");
                long wait = current.revertEligibleAt().getEpochSecond() - now.getEpochSecond();
                throw new ConflictException("Instance can be reverted in " + wait + " second(s)");
            }

            OrchestratorConfig config = configStore.require();
            checkImageAllowed(config, challenge.image());
            OrchestratorResult<Boolean> removed = terminator.terminate(config, current, "revert");
            if (!removed.isSuccess()) {
                metrics.recordRevert("failure");
                throw new TransportException("Failed to remove instance before revert: " + removed.error());
            }

            ProvisionOutcome outcome = create(config, participant, challenge);
            metrics.recordRevert("success");
            log.info("Reverted instance {} -> {}", current.handle(), outcome.instance().handle());
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Hook for the scoring side: a solved challenge's instances for the participant are torn down.
     * Teardown failures are logged; the stale sweep catches them later.
     *
     * @return number of instances removed
     */
    public int onSolve(Participant participant, long challengeId) {
        MdcContext.setParticipant(participant);
        try {
            OrchestratorConfig config = configStore.require();
            int removed = 0;
            for (Instance instance : tracker.findByParticipant(participant)) {
                if (instance.challengeId() == challengeId
                        && terminator.terminate(config, instance, "solve").isSuccess()) {
                    removed++;
                }
            }
            log.info("Solve of challenge {} by {} removed {} instance(s)", challengeId, participant.key(), removed);
            return removed;
        } finally {
            MdcContext.clear();
        }
    }

    public Instance forceKill(String handle) {
        Instance instance = tracker.findByHandle(handle)
                .orElseThrow(() -> new NotFoundException("No instance with handle " + handle));
        OrchestratorConfig config = configStore.require();
        OrchestratorResult<Boolean> result = terminator.terminate(config, instance, "admin");
        if (!result.isSuccess()) {
            throw new TransportException("Failed to remove instance " + handle + ": " + result.error());
        }
        return instance;
    }

    /**
     * Kills every tracked instance, reading the tracker in keyset pages of {@code kill-batch-size}.
     */
    public BulkResult forceKillAll() {
        OrchestratorConfig config = configStore.require();
        int batchSize = properties.getKillBatchSize();
        long afterId = 0;
        int killed = 0;
        var errors = new ArrayList<String>();
        while (true) {
            List<Instance> batch = tracker.findBatch(afterId, batchSize);
            for (Instance instance : batch) {
                OrchestratorResult<Boolean> result = terminator.terminate(config, instance, "admin");
                if (result.isSuccess()) {
                    killed++;
                } else {
                    errors.add(instance.handle() + ": " + result.error());
                }
            }
            if (batch.size() < batchSize) {
                break;
            }
            afterId = batch.get(batch.size() - 1).id();
        }
        log.info("Force-killed {} instance(s), {} failure(s)", killed, errors.size());
        return new BulkResult(killed, errors.size(), errors);
    }

    /**
     * Tears down every instance of a challenge that is about to be deleted.
     *
     * @return outcome of the teardowns; the challenge should only be removed when it succeeded
     */
    public BulkResult onChallengeDeleted(long challengeId) {
        List<Instance> instances = tracker.findByChallenge(challengeId);
        if (instances.isEmpty()) {
            return new BulkResult(0, 0, List.of());
        }
        OrchestratorConfig config = configStore.require();
        int removed = 0;
        var errors = new ArrayList<String>();
        for (Instance instance : instances) {
            OrchestratorResult<Boolean> result = terminator.terminate(config, instance, "challenge-deleted");
            if (result.isSuccess()) {
                removed++;
            } else {
                errors.add(instance.handle() + ": " + result.error());
            }
        }
        return new BulkResult(removed, errors.size(), errors);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private ProvisionOutcome create(OrchestratorConfig config, Participant participant,
                                    ChallengeDefinition challenge) {
        SandboxKind kind = challenge.kind();

        List<PortSpec> required = inventory.requiredPorts(config, challenge);
        Set<Integer> bound = inventory.boundPorts(config);
        List<Integer> published = portAllocator.allocate(required.size(), bound);
        var mappings = new ArrayList<PortMapping>(required.size());
        for (int i = 0; i < required.size(); i++) {
            mappings.add(new PortMapping(published.get(i), required.get(i)));
        }
        metrics.recordPortsAllocated(mappings.size());

        List<ResolvedSecret> secrets = kind == SandboxKind.MULTI_PART
                ? secretVault.resolve(config, challenge.secrets())
                : List.of();

        var request = new SandboxRequest(
                SandboxNames.forInstance(kind, participant, challenge.id(), challenge.image()),
                challenge.image(), mappings, secrets);

        OrchestratorResult<ProvisionedSandbox> result = providers.forKind(kind).openSandbox(config, request);
        metrics.recordProvision(kind.name(), result.isSuccess());
        if (!result.isSuccess()) {
            throw new TransportException("Failed to create sandbox: " + result.error());
        }
        ProvisionedSandbox sandbox = result.value();

        Instant createdAt = now();
        var instance = new Instance(0, participant, challenge.id(), challenge.image(), kind,
                sandbox.handle(), sandbox.ports(), config.publicHost(),
                createdAt, createdAt.plus(properties.getRevertCooldown()));

        try {
            Instance stored = tracker.insert(instance);
            log.info("Provisioned {} sandbox {} on ports {}", kind, sandbox.handle(), PortMapping.join(sandbox.ports()));
            return new ProvisionOutcome(stored, true);
        } catch (ConflictException e) {
            return resolveRace(config, instance, e);
        } catch (RuntimeException e) {
            log.error("Recording sandbox {} failed, removing it: {}", sandbox.handle(), e.getMessage());
            discard(config, instance);
            throw e;
        }
    }

    /**
     * A concurrent request recorded the same key first.
     */
    private ProvisionOutcome resolveRace(OrchestratorConfig config, Instance ours, ConflictException cause) {
        Optional<Instance> winner = tracker.find(ours.key());
        if (winner.isPresent() && winner.get().handle().equals(ours.handle())) {
            return new ProvisionOutcome(winner.get(), false);
        }
        log.warn("Concurrent provisioning for {} detected, removing duplicate sandbox {}", ours.key(), ours.handle());
        discard(config, ours);
        throw new ConflictException("A concurrent request is already provisioning this instance", cause);
    }

    /**
     * Removes a sandbox that was created but has no tracker record.
     */
    private void discard(OrchestratorConfig config, Instance unrecorded) {
        OrchestratorResult<Boolean> removed =
                providers.forKind(unrecorded.kind()).teardownSandbox(config, unrecorded.handle());
        if (!removed.isSuccess()) {
            log.error("Unrecorded sandbox {} could not be removed: {}", unrecorded.handle(), removed.error());
        }
    }

    private ChallengeDefinition requireChallenge(long challengeId) {
        return challengeStore.findById(challengeId)
                .orElseThrow(() -> new NotFoundException("Challenge " + challengeId + " not found"));
    }

    private static void checkImageAllowed(OrchestratorConfig config, String image) {
        InputValidator.requireImageReference(image);
        if (!config.allowsImage(image)) {
            throw new ValidationException("Image repository " + OrchestratorConfig.repositoryOf(image)
                    + " is not in the allowed repositories");
        }
    }

    private static InstanceKey keyOf(Participant participant, ChallengeDefinition challenge) {
        return new InstanceKey(participant, challenge.id(), challenge.image());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
