package com.arenabox.core.error;

/**
 * Thrown when the orchestrator is unreachable, times out, or answers with something unusable.
 */
public class TransportException extends SandboxException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
