package com.arenabox.core.persistence;

import com.arenabox.core.model.Instance;
import com.arenabox.core.model.InstanceKey;
import com.arenabox.core.model.Participant;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted record of every active sandbox, unique per (participant, challenge, image).
 *
 * <p>Participant-scoped queries filter by participant in the store itself so their cost follows the
 * participant's own footprint, not the total number of instances.
 */
public interface InstanceTracker {

    Optional<Instance> find(InstanceKey key);

    Optional<Instance> findByHandle(String handle);

    /**
     * Inserts a new record.
     *
     * @return the stored instance with its row id
     * @throws com.arenabox.core.error.ConflictException if a record with the same key exists
     */
    Instance insert(Instance instance);

    /**
     * @return true if a record was removed
     */
    boolean delete(InstanceKey key);

    List<Instance> findByParticipant(Participant participant);

    /**
     * Instances of one participant created at or before {@code cutoff}.
     */
    List<Instance> findStale(Participant participant, Instant cutoff);

    List<Instance> findByChallenge(long challengeId);

    /**
     * Keyset page over all instances ordered by row id.
     */
    List<Instance> findBatch(long afterId, int limit);

    /**
     * Keyset page over all instances created at or before {@code cutoff}.
     */
    List<Instance> findStaleBatch(Instant cutoff, long afterId, int limit);
}
