package com.golden.controlplane.dto;

import com.golden.controlplane.service.breaker.CircuitState;

import java.time.Duration;
import java.time.Instant;

public record BreakerStats(
        String name,
        CircuitState state,
        int consecutiveFailures,
        int failureThreshold,
        Duration recoveryTimeout,
        boolean critical,
        long totalCalls,
        long totalSuccesses,
        long totalFailures,
        long rejectedCalls,
        Instant openedAt,
        Instant lastStateChange,
        Duration retryAfter
) {
}
