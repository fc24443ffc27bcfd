package com.golden.controlplane.service.breaker;

/**
 * Callbacks fired outside the breaker's lock.
 */
public interface CircuitBreakerListener {

    default void onRegistered(CircuitBreaker breaker) {
    }

    default void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {
    }

    default void onReset(CircuitBreaker breaker) {
    }

    default void onRejected(CircuitBreaker breaker) {
    }
}
