package com.golden.controlplane.service.breaker;

import java.time.Duration;

/**
 * Result value of a breaker-guarded call. REJECTED means the operation was never invoked.
 */
public record BreakerOutcome<T>(Status status, T value, Throwable error, Duration retryAfter) {

    public enum Status {
        SUCCESS,
        FAILURE,
        REJECTED
    }

    public static <T> BreakerOutcome<T> success(T value) {
        return new BreakerOutcome<>(Status.SUCCESS, value, null, null);
    }

    public static <T> BreakerOutcome<T> failure(Throwable error) {
        return new BreakerOutcome<>(Status.FAILURE, null, error, null);
    }

    public static <T> BreakerOutcome<T> rejected(Duration retryAfter) {
        return new BreakerOutcome<>(Status.REJECTED, null, null, retryAfter);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
