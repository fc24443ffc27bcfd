package com.golden.controlplane.service;

import com.golden.controlplane.event.CriticalAlertEvent;
import com.golden.controlplane.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private ControlPlaneMetrics metrics;

    @Test
    void publishesEventAndCountsAlert() {
        MutableClock clock = MutableClock.fixed();
        AlertService alertService = new AlertService(eventPublisher, metrics, clock);

        alertService.sendAlert("CIRCUIT_OPEN", "llm-gateway opened", null, Map.of("breaker", "llm-gateway"));

        ArgumentCaptor<CriticalAlertEvent> captor = ArgumentCaptor.forClass(CriticalAlertEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        CriticalAlertEvent event = captor.getValue();
        assertThat(event.type()).isEqualTo("CIRCUIT_OPEN");
        assertThat(event.raisedAt()).isEqualTo(clock.instant());
        assertThat(event.metadata()).containsEntry("breaker", "llm-gateway");
        verify(metrics).recordAlert("CIRCUIT_OPEN");
    }
}
