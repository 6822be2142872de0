package com.arenabox.sandbox;

import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.ResolvedSecret;

import java.util.List;

/**
 * Everything a {@link SandboxProvider} needs to create one sandbox.
 *
 * @param name    orchestrator-side name, stable per instance key
 * @param image   image reference
 * @param ports   allocated host/published port to container port mappings
 * @param secrets resolved secrets to attach, empty for single containers
 */
public record SandboxRequest(
        String name,
        String image,
        List<PortMapping> ports,
        List<ResolvedSecret> secrets
) {

    public SandboxRequest {
        ports = ports != null ? List.copyOf(ports) : List.of();
        secrets = secrets != null ? List.copyOf(secrets) : List.of();
    }
}
