package com.golden.controlplane.exception;

import java.time.Duration;

/**
 * Fast-fail signal: the protected operation was not attempted.
 */
public class CircuitOpenException extends ControlPlaneException {
    private final String breakerName;
    private final Duration retryAfter;

    public CircuitOpenException(String breakerName, String message, Duration retryAfter) {
        super(message);
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
