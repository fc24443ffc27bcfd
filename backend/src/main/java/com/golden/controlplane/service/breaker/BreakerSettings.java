package com.golden.controlplane.service.breaker;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.exception.ValidationException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Immutable configuration of one breaker.
 *
 * @param recordFailure decides which exceptions count as failures; others pass through unrecorded
 */
public record BreakerSettings(
        int failureThreshold,
        Duration recoveryTimeout,
        int halfOpenMaxCalls,
        boolean critical,
        Predicate<Throwable> recordFailure
) {

    public BreakerSettings {
        if (failureThreshold < 1) {
            throw new ValidationException("failureThreshold must be >= 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new ValidationException("recoveryTimeout must be >= 0");
        }
        if (halfOpenMaxCalls < 1) {
            throw new ValidationException("halfOpenMaxCalls must be >= 1");
        }
        if (recordFailure == null) {
            recordFailure = error -> true;
        }
    }

    public static BreakerSettings of(int failureThreshold, Duration recoveryTimeout) {
        return new BreakerSettings(failureThreshold, recoveryTimeout, 1, false, null);
    }

    public static BreakerSettings from(ControlPlaneProperties.Breaker breaker) {
        return new BreakerSettings(breaker.getFailureThreshold(), breaker.getRecoveryTimeout(),
                breaker.getHalfOpenMaxCalls(), breaker.isCritical(), null);
    }

    public BreakerSettings withCritical(boolean critical) {
        return new BreakerSettings(failureThreshold, recoveryTimeout, halfOpenMaxCalls, critical, recordFailure);
    }

    public BreakerSettings withHalfOpenMaxCalls(int halfOpenMaxCalls) {
        return new BreakerSettings(failureThreshold, recoveryTimeout, halfOpenMaxCalls, critical, recordFailure);
    }

    public BreakerSettings recordingOnly(Predicate<Throwable> recordFailure) {
        return new BreakerSettings(failureThreshold, recoveryTimeout, halfOpenMaxCalls, critical, recordFailure);
    }
}
