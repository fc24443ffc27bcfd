package com.golden.controlplane.service;

import com.golden.controlplane.event.CriticalAlertEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Alerting sink. Publishes {@link CriticalAlertEvent}s; pager/chat integrations subscribe to them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertService {

    private final ApplicationEventPublisher eventPublisher;
    private final ControlPlaneMetrics metrics;
    private final Clock clock;

    public void sendAlert(String type, String message) {
        sendAlert(type, message, null, Map.of());
    }

    public void sendAlert(String type, String message, Throwable cause, Map<String, Object> metadata) {
        log.error("🚨 CRITICAL [{}] {}", type, message);
        metrics.recordAlert(type);
        eventPublisher.publishEvent(new CriticalAlertEvent(type, message, cause, Instant.now(clock),
                metadata == null ? Map.of() : Map.copyOf(metadata)));
    }
}
