package com.golden.controlplane.service.breaker;

import com.golden.controlplane.model.CircuitBreakerState;
import com.golden.controlplane.repository.CircuitBreakerStateRepository;
import com.golden.controlplane.dto.BreakerStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes a breaker snapshot on every transition or reset and restores it when the breaker is
 * registered. Storage trouble is logged and ignored; the in-memory breaker stays authoritative.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerStatePersister implements CircuitBreakerListener {

    private final CircuitBreakerStateRepository repository;
    private final Clock clock;

    @Override
    public void onRegistered(CircuitBreaker breaker) {
        try {
            repository.findById(breaker.getName()).ifPresent(saved -> breaker.restore(
                    saved.getState(),
                    saved.getConsecutiveFailures(),
                    saved.getOpenedAt(),
                    saved.getTotalSuccesses(),
                    saved.getTotalFailures(),
                    saved.getLastStateChange()));
        } catch (Exception e) {
            log.warn("Failed to restore circuit breaker '{}': {}", breaker.getName(), e.getMessage());
        }
    }

    @Override
    public void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {
        persist(breaker);
    }

    @Override
    public void onReset(CircuitBreaker breaker) {
        persist(breaker);
    }

    private void persist(CircuitBreaker breaker) {
        try {
            BreakerStats stats = breaker.stats();
            repository.save(CircuitBreakerState.builder()
                    .name(stats.name())
                    .state(stats.state())
                    .consecutiveFailures(stats.consecutiveFailures())
                    .failureThreshold(stats.failureThreshold())
                    .recoveryTimeoutMs(stats.recoveryTimeout().toMillis())
                    .openedAt(stats.openedAt())
                    .totalSuccesses(stats.totalSuccesses())
                    .totalFailures(stats.totalFailures())
                    .lastStateChange(stats.lastStateChange())
                    .updatedAt(Instant.now(clock))
                    .build());
        } catch (Exception e) {
            log.warn("Failed to persist circuit breaker '{}': {}", breaker.getName(), e.getMessage());
        }
    }
}
