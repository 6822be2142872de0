package com.arenabox.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/internal/solves.
 */
public record SolveRequest(
        @JsonProperty("participant_kind") String participantKind,
        @JsonProperty("participant_id") String participantId,
        @JsonProperty("challenge_id") Long challengeId
) {}
