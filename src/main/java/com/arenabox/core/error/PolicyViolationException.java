package com.arenabox.core.error;

/**
 * Thrown when secret material would cross a channel that is not encrypted end to end.
 */
public class PolicyViolationException extends SandboxException {

    public PolicyViolationException(String message) {
        super(message);
    }
}
