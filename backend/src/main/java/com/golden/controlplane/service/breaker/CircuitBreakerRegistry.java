package com.golden.controlplane.service.breaker;

import com.golden.controlplane.dto.BreakerStats;
import com.golden.controlplane.exception.ConflictException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Catalogue of named breakers. One instance is created at startup and injected wherever breakers are
 * needed; tests build their own.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final BreakerSettings defaults;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners;

    public CircuitBreakerRegistry(BreakerSettings defaults, Clock clock, List<CircuitBreakerListener> listeners) {
        this.defaults = defaults;
        this.clock = clock;
        this.listeners = List.copyOf(listeners);
    }

    public CircuitBreakerRegistry(BreakerSettings defaults, Clock clock) {
        this(defaults, clock, List.of());
    }

    public CircuitBreaker register(String name, BreakerSettings settings) {
        return register(name, new CircuitBreaker(name, settings, clock));
    }

    /**
     * @throws ConflictException if a different breaker already holds the name
     */
    public CircuitBreaker register(String name, CircuitBreaker breaker) {
        CircuitBreaker existing = breakers.putIfAbsent(name, breaker);
        if (existing != null) {
            if (existing == breaker) {
                return existing;
            }
            throw new ConflictException("Circuit breaker already registered: " + name);
        }
        attach(breaker);
        log.info("Registered circuit breaker '{}' threshold={} recoveryTimeout={}",
                name, breaker.getSettings().failureThreshold(), breaker.getSettings().recoveryTimeout());
        return breaker;
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public CircuitBreaker getOrCreate(String name) {
        CircuitBreaker existing = breakers.get(name);
        if (existing != null) {
            return existing;
        }
        CircuitBreaker created = new CircuitBreaker(name, defaults, clock);
        CircuitBreaker raced = breakers.putIfAbsent(name, created);
        if (raced != null) {
            return raced;
        }
        attach(created);
        return created;
    }

    public Set<String> names() {
        return new TreeSet<>(breakers.keySet());
    }

    public Collection<CircuitBreaker> all() {
        return List.copyOf(breakers.values());
    }

    public Map<String, BreakerStats> allStats() {
        Map<String, BreakerStats> stats = new TreeMap<>();
        breakers.forEach((name, breaker) -> stats.put(name, breaker.stats()));
        return stats;
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    /**
     * Administrative escape hatch: every breaker back to CLOSED with zero counters.
     */
    public int resetAll() {
        log.warn("Resetting all {} circuit breakers", breakers.size());
        breakers.values().forEach(CircuitBreaker::reset);
        return breakers.size();
    }

    private void attach(CircuitBreaker breaker) {
        for (CircuitBreakerListener listener : listeners) {
            breaker.addListener(listener);
            try {
                listener.onRegistered(breaker);
            } catch (RuntimeException e) {
                log.warn("Circuit breaker '{}' registration hook failed: {}", breaker.getName(), e.getMessage());
            }
        }
    }
}
