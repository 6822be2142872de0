package com.arenabox.sandbox;

import com.arenabox.core.model.PortMapping;

import java.util.List;

/**
 * A sandbox the orchestrator accepted.
 *
 * @param handle container or service id
 * @param ports  port mappings actually in effect
 */
public record ProvisionedSandbox(String handle, List<PortMapping> ports) {

    public ProvisionedSandbox {
        ports = ports != null ? List.copyOf(ports) : List.of();
    }
}
