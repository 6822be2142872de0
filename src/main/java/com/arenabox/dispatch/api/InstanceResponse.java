package com.arenabox.dispatch.api;

import com.arenabox.core.model.Instance;
import com.arenabox.core.model.PortMapping;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outbound JSON view of an instance. Timestamps are epoch seconds.
 */
public record InstanceResponse(
        long id,
        @JsonProperty("participant_kind") String participantKind,
        @JsonProperty("participant_id") String participantId,
        @JsonProperty("challenge_id") long challengeId,
        String image,
        String kind,
        String handle,
        String host,
        List<String> ports,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("revert_eligible_at") long revertEligibleAt
) {

    public static InstanceResponse from(Instance instance) {
        return new InstanceResponse(
                instance.id(),
                instance.participant().kind().name().toLowerCase(),
                instance.participant().id(),
                instance.challengeId(),
                instance.image(),
                instance.kind().name(),
                instance.handle(),
                instance.host(),
                instance.ports().stream().map(PortMapping::toString).toList(),
                instance.createdAt().getEpochSecond(),
                instance.revertEligibleAt().getEpochSecond()
        );
    }
}
