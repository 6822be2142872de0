package com.arenabox.dispatch.api;

import com.arenabox.core.model.SecretReference;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for PUT /api/v1/admin/challenges/{id}.
 *
 * @param exposedPorts comma-joined declaration, e.g. {@code "80/tcp,53/udp"}
 * @param kind         {@code SINGLE} or {@code MULTI_PART}; nullable, defaults to {@code SINGLE}
 */
public record ChallengeRequest(
        String name,
        String image,
        @JsonProperty("exposed_ports") String exposedPorts,
        String kind,
        List<SecretReference> secrets
) {}
