package com.arenabox.core.error;

/**
 * Thrown when a challenge, instance or secret does not exist.
 */
public class NotFoundException extends SandboxException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
