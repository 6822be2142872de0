package com.arenabox.core.model;

import java.util.List;

/**
 * Static description of a challenge as configured by an administrator.
 *
 * @param id           challenge id from the host platform
 * @param name         display name
 * @param image        image reference, e.g. {@code nginx:alpine}
 * @param exposedPorts challenge-level port declarations
 * @param kind         single container or multi-part service
 * @param secrets      ordered secret references, empty for {@link SandboxKind#SINGLE}
 */
public record ChallengeDefinition(
        long id,
        String name,
        String image,
        List<PortSpec> exposedPorts,
        SandboxKind kind,
        List<SecretReference> secrets
) {

    public ChallengeDefinition {
        exposedPorts = exposedPorts != null ? List.copyOf(exposedPorts) : List.of();
        secrets = secrets != null && kind == SandboxKind.MULTI_PART ? List.copyOf(secrets) : List.of();
    }

    public boolean references(String secretId) {
        return secrets.stream().anyMatch(s -> s.id().equals(secretId));
    }
}
