package com.golden.controlplane.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "control-plane")
@Data
public class ControlPlaneProperties {

    private CircuitBreakers circuitBreakers = new CircuitBreakers();
    private Budget budget = new Budget();
    private Idempotency idempotency = new Idempotency();
    private DeadLetter deadLetter = new DeadLetter();
    private Governance governance = new Governance();

    @Data
    public static class CircuitBreakers {
        private Breaker defaults = new Breaker();
        private Map<String, Breaker> instances = new LinkedHashMap<>();
    }

    @Data
    public static class Breaker {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int halfOpenMaxCalls = 1;
        private boolean critical = false;
    }

    @Data
    public static class Budget {
        private long defaultTotalLimit = 1_000_000L;
        private Duration idempotencyTtl = Duration.ofMinutes(5);
        private Duration inProgressTtl = Duration.ofSeconds(30);
        private Duration duplicateWait = Duration.ofSeconds(5);
        private Duration duplicatePollInterval = Duration.ofMillis(50);
        private Duration reservationTtl = Duration.ofHours(1);
        private boolean reconciliationEnabled = true;
        private long sweepIntervalMs = 60_000L;
        private long reconciliationIntervalMs = 300_000L;
    }

    @Data
    public static class Idempotency {
        /**
         * jdbc or redis.
         */
        private String store = "jdbc";
        private String keyPrefix = "control-plane:";
        private long cleanupIntervalMs = 60_000L;
    }

    @Data
    public static class DeadLetter {
        private int maxAttempts = 5;
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private Duration lease = Duration.ofMinutes(2);
        private int batchSize = 50;
        private long pollIntervalMs = 1_000L;
    }

    @Data
    public static class Governance {
        private int defaultMaxUpdatesPerDay = 5;
        private Duration defaultCooldown = Duration.ofHours(2);
        private boolean defaultRequiresHumanApproval = false;
    }
}
