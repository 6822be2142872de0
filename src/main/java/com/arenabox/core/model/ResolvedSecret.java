package com.arenabox.core.model;

/**
 * A secret reference resolved against the orchestrator's secret list, ready to attach to a service.
 */
public record ResolvedSecret(String id, String name, boolean protectedMode) {

    /** File mode used when the secret is mounted into the service's tasks. */
    public long fileMode() {
        return protectedMode ? 0600 : 0777;
    }
}
