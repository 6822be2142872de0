package com.arenabox.core.error;

/**
 * Thrown when a port spec, image reference, secret name or secret id is malformed.
 */
public class ValidationException extends SandboxException {

    public ValidationException(String message) {
        super(message);
    }
}
