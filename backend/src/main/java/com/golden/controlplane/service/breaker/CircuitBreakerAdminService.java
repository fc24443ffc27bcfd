package com.golden.controlplane.service.breaker;

import com.golden.controlplane.dto.BreakerStats;
import com.golden.controlplane.exception.NotFoundException;
import com.golden.controlplane.service.AuditEventService;
import com.golden.controlplane.service.ControlPlaneMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Operator-facing breaker controls. Every manual reset is audited with the acting identity.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerAdminService {

    private final CircuitBreakerRegistry registry;
    private final AuditEventService auditEventService;
    private final ControlPlaneMetrics metrics;

    public Map<String, BreakerStats> allStats() {
        return registry.allStats();
    }

    public BreakerStats stats(String name) {
        return registry.get(name)
                .map(CircuitBreaker::stats)
                .orElseThrow(() -> new NotFoundException("Circuit breaker not found: " + name));
    }

    public void reset(String name, String actor) {
        if (!registry.reset(name)) {
            throw new NotFoundException("Circuit breaker not found: " + name);
        }
        metrics.recordBreakerReset();
        auditEventService.recordEvent(actor, "CIRCUIT_BREAKER", "RESET",
                "Circuit breaker reset: " + name, Map.of("breaker", name));
    }

    public int resetAll(String actor) {
        int count = registry.resetAll();
        metrics.recordBreakerReset();
        log.warn("All circuit breakers reset by {}", actor);
        auditEventService.recordEvent(actor, "CIRCUIT_BREAKER", "RESET_ALL",
                "All circuit breakers reset", Map.of("count", count));
        return count;
    }
}
