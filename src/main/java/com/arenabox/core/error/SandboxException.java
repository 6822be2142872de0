package com.arenabox.core.error;

/**
 * Base type for every failure the sandbox lifecycle reports to its callers.
 */
public abstract class SandboxException extends RuntimeException {

    protected SandboxException(String message) {
        super(message);
    }

    protected SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
