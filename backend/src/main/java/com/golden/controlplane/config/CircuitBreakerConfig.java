package com.golden.controlplane.config;

import com.golden.controlplane.service.breaker.BreakerSettings;
import com.golden.controlplane.service.breaker.CircuitBreakerListener;
import com.golden.controlplane.service.breaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
@Slf4j
public class CircuitBreakerConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ControlPlaneProperties properties,
                                                         Clock clock,
                                                         List<CircuitBreakerListener> listeners) {
        ControlPlaneProperties.CircuitBreakers config = properties.getCircuitBreakers();
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(BreakerSettings.from(config.getDefaults()), clock, listeners);
        config.getInstances().forEach((name, breaker) -> registry.register(name, BreakerSettings.from(breaker)));
        log.info("Circuit breaker registry ready with {} configured breakers", config.getInstances().size());
        return registry;
    }
}
