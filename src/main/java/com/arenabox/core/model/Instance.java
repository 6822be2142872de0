package com.arenabox.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A running sandbox tracked for one participant and one challenge.
 *
 * @param id               tracker row id, {@code 0} before insertion
 * @param participant      owner
 * @param challengeId      challenge the sandbox serves
 * @param image            image the sandbox was created from
 * @param kind             sandbox kind, kept so teardown works after the challenge is gone
 * @param handle           container or service id assigned by the orchestrator
 * @param ports            published port mappings
 * @param host             host participants connect to
 * @param createdAt        creation time
 * @param revertEligibleAt earliest time a revert is accepted
 */
public record Instance(
        long id,
        Participant participant,
        long challengeId,
        String image,
        SandboxKind kind,
        String handle,
        List<PortMapping> ports,
        String host,
        Instant createdAt,
        Instant revertEligibleAt
) {

    public Instance {
        ports = ports != null ? List.copyOf(ports) : List.of();
    }

    public InstanceKey key() {
        return new InstanceKey(participant, challengeId, image);
    }

    public boolean isRevertEligible(Instant now) {
        return !now.isBefore(revertEligibleAt);
    }

    public Instance withId(long newId) {
        return new Instance(newId, participant, challengeId, image, kind, handle, ports, host,
                createdAt, revertEligibleAt);
    }
}
