package com.golden.controlplane.model;

import com.golden.controlplane.service.breaker.CircuitState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last known snapshot of a named breaker, reloaded when the breaker is registered at startup.
 */
@Entity
@Table(name = "circuit_breaker_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerState {

    @Id
    @Column(name = "name", length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CircuitState state;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "failure_threshold", nullable = false)
    private int failureThreshold;

    @Column(name = "recovery_timeout_ms", nullable = false)
    private long recoveryTimeoutMs;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "total_successes", nullable = false)
    private long totalSuccesses;

    @Column(name = "total_failures", nullable = false)
    private long totalFailures;

    @Column(name = "last_state_change")
    private Instant lastStateChange;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
