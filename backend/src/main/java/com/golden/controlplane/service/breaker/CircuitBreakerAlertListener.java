package com.golden.controlplane.service.breaker;

import com.golden.controlplane.event.CircuitStateChangedEvent;
import com.golden.controlplane.service.AlertService;
import com.golden.controlplane.service.ControlPlaneMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CircuitBreakerAlertListener implements CircuitBreakerListener {

    private final AlertService alertService;
    private final ControlPlaneMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public void onRegistered(CircuitBreaker breaker) {
        metrics.registerBreakerGauge(breaker.getName(), () -> breaker.getState().code());
    }

    @Override
    public void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {
        boolean critical = breaker.getSettings().critical();
        eventPublisher.publishEvent(new CircuitStateChangedEvent(breaker.getName(), from, to, critical, Instant.now(clock)));
        if (critical && to == CircuitState.OPEN) {
            alertService.sendAlert("CIRCUIT_OPEN",
                    "Critical dependency '" + breaker.getName() + "' is unreachable, circuit opened",
                    null,
                    Map.of("breaker", breaker.getName(), "previousState", from.name()));
        }
    }

    @Override
    public void onRejected(CircuitBreaker breaker) {
        metrics.recordBreakerRejection(breaker.getName());
    }
}
