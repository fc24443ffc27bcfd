package com.golden.controlplane.service.dlq;

import com.golden.controlplane.config.ControlPlaneProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryBackoffTest {

    @Test
    void delayDoublesPerAttemptUntilCapped() {
        ControlPlaneProperties properties = new ControlPlaneProperties();
        properties.getDeadLetter().setBaseBackoff(Duration.ofSeconds(1));
        properties.getDeadLetter().setMaxBackoff(Duration.ofSeconds(30));
        RetryBackoff backoff = new RetryBackoff(properties);

        assertThat(backoff.delayAfter(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayAfter(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayAfter(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(backoff.delayAfter(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.delayAfter(12)).isEqualTo(Duration.ofSeconds(30));
    }
}
