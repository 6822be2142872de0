package com.arenabox.transport;

import com.arenabox.core.error.TransportException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one orchestrator call. Unreachable endpoints, timeouts and unusable responses are
 * ordinary outcomes here, not exceptions; callers branch on {@link #isSuccess()}.
 *
 * @param <T> type of the parsed value
 */
public final class OrchestratorResult<T> {

    private final T value;
    private final String error;
    private final int statusCode;

    private OrchestratorResult(T value, String error, int statusCode) {
        this.value = value;
        this.error = error;
        this.statusCode = statusCode;
    }

    public static <T> OrchestratorResult<T> success(T value) {
        return new OrchestratorResult<>(Objects.requireNonNull(value, "value"), null, 0);
    }

    public static <T> OrchestratorResult<T> failure(String error) {
        return new OrchestratorResult<>(null, error, 0);
    }

    /**
     * @param statusCode HTTP status the engine answered with, {@code 0} when no response arrived
     */
    public static <T> OrchestratorResult<T> failure(String error, int statusCode) {
        return new OrchestratorResult<>(null, error, statusCode);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + error);
        }
        return value;
    }

    public String error() {
        return error;
    }

    public int statusCode() {
        return statusCode;
    }

    public <R> OrchestratorResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error, statusCode);
    }

    /**
     * Unwraps the value or reports the failure as a {@link TransportException}.
     */
    public T orElseThrow(String operation) {
        if (!isSuccess()) {
            throw new TransportException("Orchestrator unavailable during " + operation + ": " + error);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OrchestratorResult[ok]" : "OrchestratorResult[error=" + error + "]";
    }
}
