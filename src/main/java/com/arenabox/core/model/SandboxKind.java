package com.arenabox.core.model;

/**
 * Shape of the sandbox created for a challenge.
 */
public enum SandboxKind {
    /** A standalone container with host ports bound directly. */
    SINGLE,
    /** A swarm service with published endpoints and attached secrets. */
    MULTI_PART
}
