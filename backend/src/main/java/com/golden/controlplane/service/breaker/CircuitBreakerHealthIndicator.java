package com.golden.controlplane.service.breaker;

import com.golden.controlplane.dto.BreakerStats;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Reports breaker health under {@code circuitBreakers}:
 * <ul>
 *   <li>UP: every breaker CLOSED</li>
 *   <li>DEGRADED: some breaker not CLOSED, no critical breaker OPEN</li>
 *   <li>DOWN: a critical breaker is OPEN</li>
 * </ul>
 */
@Component("circuitBreakersHealthIndicator")
@RequiredArgsConstructor
public class CircuitBreakerHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry registry;

    @Override
    public Health health() {
        Map<String, BreakerStats> stats = registry.allStats();
        Map<String, String> states = new TreeMap<>();
        boolean allClosed = true;
        boolean criticalOpen = false;
        for (BreakerStats breaker : stats.values()) {
            states.put(breaker.name(), breaker.state().name());
            if (breaker.state() != CircuitState.CLOSED) {
                allClosed = false;
            }
            if (breaker.critical() && breaker.state() == CircuitState.OPEN) {
                criticalOpen = true;
            }
        }

        Health.Builder builder = new Health.Builder();
        if (criticalOpen) {
            builder.down().withDetail("status", "Critical dependency unavailable");
        } else if (!allClosed) {
            builder.status("DEGRADED").withDetail("status", "Some dependencies failing");
        } else {
            builder.up().withDetail("status", "All circuits closed");
        }
        return builder.withDetail("breakers", states).build();
    }
}
