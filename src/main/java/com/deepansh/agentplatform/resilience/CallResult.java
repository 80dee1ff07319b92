package com.deepansh.agentplatform.resilience;

import java.util.Optional;

/**
 * Outcome of a circuit-protected call that does not throw for expected failures.
 *
 * DEGRADED means the dependency was skipped (open circuit) or failed and a
 * fallback value was used instead; FAILED means it was attempted, failed and
 * no fallback was available.
 */
public final class CallResult<T> {

    public enum Status { SUCCESS, DEGRADED, FAILED }

    private final Status status;
    private final T value;
    private final RuntimeException error;

    private CallResult(Status status, T value, RuntimeException error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(Status.SUCCESS, value, null);
    }

    public static <T> CallResult<T> degraded(T fallbackValue, RuntimeException cause) {
        return new CallResult<>(Status.DEGRADED, fallbackValue, cause);
    }

    public static <T> CallResult<T> failed(RuntimeException error) {
        return new CallResult<>(Status.FAILED, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "CallResult{status=" + status + (error != null ? ", error=" + error.getMessage() : "") + "}";
    }
}
