package com.golden.controlplane.service.dlq;

import com.golden.controlplane.config.ControlPlaneProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential retry delay: {@code base * 2^attempt}, capped at the configured maximum.
 */
@Component
public class RetryBackoff {

    private final IntervalFunction intervalFunction;

    public RetryBackoff(ControlPlaneProperties properties) {
        ControlPlaneProperties.DeadLetter config = properties.getDeadLetter();
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                config.getBaseBackoff().toMillis(), 2.0, config.getMaxBackoff().toMillis());
    }

    /**
     * @param attempt number of failed attempts so far, at least 1
     */
    public Duration delayAfter(int attempt) {
        return Duration.ofMillis(intervalFunction.apply(Math.max(1, attempt) + 1));
    }
}
