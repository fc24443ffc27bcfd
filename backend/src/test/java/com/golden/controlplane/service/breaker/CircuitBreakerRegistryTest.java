package com.golden.controlplane.service.breaker;

import com.golden.controlplane.dto.BreakerStats;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CircuitBreakerRegistryTest {

    private MutableClock clock;
    private CircuitBreakerListener listener;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.fixed();
        listener = mock(CircuitBreakerListener.class);
        registry = new CircuitBreakerRegistry(BreakerSettings.of(2, Duration.ofSeconds(10)), clock, List.of(listener));
    }

    @Test
    void registerAndGetByName() {
        CircuitBreaker breaker = registry.register("search", BreakerSettings.of(3, Duration.ofSeconds(5)));

        assertThat(registry.get("search")).containsSame(breaker);
        assertThat(registry.get("missing")).isEmpty();
        verify(listener).onRegistered(breaker);
    }

    @Test
    void rejectsSecondBreakerUnderSameName() {
        registry.register("search", BreakerSettings.of(3, Duration.ofSeconds(5)));

        assertThatThrownBy(() -> registry.register("search", BreakerSettings.of(1, Duration.ofSeconds(1))))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void getOrCreateUsesDefaultsAndReturnsSameInstance() {
        CircuitBreaker first = registry.getOrCreate("embeddings");
        CircuitBreaker second = registry.getOrCreate("embeddings");

        assertThat(second).isSameAs(first);
        assertThat(first.getSettings().failureThreshold()).isEqualTo(2);
        assertThat(registry.names()).containsExactly("embeddings");
    }

    @Test
    void allStatsAndResetAll() {
        CircuitBreaker llm = registry.register("llm", BreakerSettings.of(1, Duration.ofSeconds(30)));
        registry.register("db", BreakerSettings.of(5, Duration.ofSeconds(30)));
        llm.execute(() -> {
            throw new IllegalStateException("boom");
        });

        Map<String, BreakerStats> before = registry.allStats();
        assertThat(before).containsOnlyKeys("db", "llm");
        assertThat(before.get("llm").state()).isEqualTo(CircuitState.OPEN);

        assertThat(registry.resetAll()).isEqualTo(2);

        assertThat(registry.allStats().values())
                .allSatisfy(stats -> {
                    assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
                    assertThat(stats.totalFailures()).isZero();
                });
        verify(listener).onReset(llm);
    }

    @Test
    void resetOfUnknownBreakerReportsFalse() {
        assertThat(registry.reset("nope")).isFalse();
    }
}
