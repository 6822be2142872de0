package com.arenabox.core.error;

/**
 * Thrown when no free port set could be drawn within the attempt cap.
 */
public class PortExhaustionException extends SandboxException {

    public PortExhaustionException(String message) {
        super(message);
    }

    public PortExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }
}
