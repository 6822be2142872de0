package com.arenabox.sandbox;

import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.transport.OrchestratorResult;

/**
 * Per-kind create/destroy strategy used by the shared sandbox lifecycle.
 * Implementations: {@link ContainerSandboxProvider} (single), {@link ServiceSandboxProvider} (multi-part).
 */
public interface SandboxProvider {

    SandboxKind kind();

    /**
     * Creates and starts a sandbox.
     * @return the orchestrator handle and effective ports, or a failed result
     */
    OrchestratorResult<ProvisionedSandbox> openSandbox(OrchestratorConfig config, SandboxRequest request);

    /**
     * Removes the sandbox. A sandbox the orchestrator no longer knows counts as removed.
     */
    OrchestratorResult<Boolean> teardownSandbox(OrchestratorConfig config, String handle);
}
