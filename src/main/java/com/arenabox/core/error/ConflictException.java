package com.arenabox.core.error;

/**
 * Thrown when a revert is not yet eligible, a secret name is taken, a secret is still referenced,
 * or an instance already exists for the same key.
 */
public class ConflictException extends SandboxException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
