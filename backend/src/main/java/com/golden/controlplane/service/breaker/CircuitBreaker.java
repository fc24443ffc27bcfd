package com.golden.controlplane.service.breaker;

import com.golden.controlplane.dto.BreakerStats;
import com.golden.controlplane.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker guarding one downstream dependency.
 * <p>
 * All bookkeeping happens under a short lock; the guarded operation itself runs outside it.
 * Recovery from OPEN is evaluated lazily on the next call, there is no background timer.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final BreakerSettings settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenInFlight;
    private Instant openedAt;
    private Instant lastStateChange;
    private long totalCalls;
    private long totalSuccesses;
    private long totalFailures;
    private long rejectedCalls;

    public CircuitBreaker(String name, BreakerSettings settings, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
        this.lastStateChange = clock.instant();
    }

    public String getName() {
        return name;
    }

    public BreakerSettings getSettings() {
        return settings;
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(listener);
    }

    /**
     * Runs the operation if the breaker admits it.
     *
     * @throws CircuitOpenException when the call is rejected without invoking the operation
     */
    public <T> T call(Supplier<T> operation) {
        Permit permit = acquire();
        if (!permit.permitted()) {
            throw new CircuitOpenException(name, "Circuit breaker '" + name + "' is OPEN", permit.retryAfter());
        }
        return invoke(permit, operation);
    }

    public void run(Runnable operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    /**
     * Same gating as {@link #call(Supplier)} but reports every outcome as a value. Only this breaker's
     * own fast-fail is REJECTED; a {@link CircuitOpenException} thrown by the operation is a FAILURE.
     */
    public <T> BreakerOutcome<T> execute(Supplier<T> operation) {
        Permit permit = acquire();
        if (!permit.permitted()) {
            return BreakerOutcome.rejected(permit.retryAfter());
        }
        try {
            return BreakerOutcome.success(invoke(permit, operation));
        } catch (RuntimeException e) {
            return BreakerOutcome.failure(e);
        }
    }

    private <T> T invoke(Permit permit, Supplier<T> operation) {
        boolean recorded = false;
        try {
            T result = operation.get();
            recorded = true;
            onSuccess(permit);
            return result;
        } catch (RuntimeException e) {
            recorded = true;
            onError(permit, e);
            throw e;
        } finally {
            if (!recorded) {
                abandon(permit);
            }
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the breaker back to CLOSED with zeroed counters.
     */
    public void reset() {
        CircuitState previous;
        lock.lock();
        try {
            previous = state;
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            halfOpenInFlight = 0;
            openedAt = null;
            lastStateChange = clock.instant();
            totalCalls = 0;
            totalSuccesses = 0;
            totalFailures = 0;
            rejectedCalls = 0;
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker '{}' manually reset (was {})", name, previous);
        if (previous != CircuitState.CLOSED) {
            fireStateChange(new Transition(previous, CircuitState.CLOSED));
        }
        listeners.forEach(listener -> safely(() -> listener.onReset(this)));
    }

    /**
     * Reloads a persisted snapshot. A breaker that was probing when the snapshot was written comes
     * back OPEN so the next call re-evaluates the recovery timeout.
     */
    public void restore(CircuitState savedState, int savedFailures, Instant savedOpenedAt,
                        long savedSuccesses, long savedTotalFailures, Instant savedLastChange) {
        lock.lock();
        try {
            state = savedState == CircuitState.HALF_OPEN ? CircuitState.OPEN : savedState;
            consecutiveFailures = savedFailures;
            openedAt = state == CircuitState.CLOSED ? null
                    : (savedOpenedAt != null ? savedOpenedAt : clock.instant());
            totalSuccesses = savedSuccesses;
            totalFailures = savedTotalFailures;
            halfOpenInFlight = 0;
            if (savedLastChange != null) {
                lastStateChange = savedLastChange;
            }
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker '{}' restored in state {}", name, state);
    }

    public BreakerStats stats() {
        lock.lock();
        try {
            return new BreakerStats(name, state, consecutiveFailures, settings.failureThreshold(),
                    settings.recoveryTimeout(), settings.critical(), totalCalls, totalSuccesses,
                    totalFailures, rejectedCalls, openedAt, lastStateChange, retryAfter(clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    private Permit acquire() {
        Transition transition = null;
        Permit permit;
        lock.lock();
        try {
            totalCalls++;
            Instant now = clock.instant();
            if (state == CircuitState.OPEN && !Duration.between(openedAt, now).minus(settings.recoveryTimeout()).isNegative()) {
                transition = moveTo(CircuitState.HALF_OPEN, now);
                halfOpenInFlight = 0;
            }
            if (state == CircuitState.OPEN
                    || (state == CircuitState.HALF_OPEN && halfOpenInFlight >= settings.halfOpenMaxCalls())) {
                rejectedCalls++;
                permit = new Permit(false, false, retryAfter(now));
            } else if (state == CircuitState.HALF_OPEN) {
                halfOpenInFlight++;
                permit = new Permit(true, true, Duration.ZERO);
            } else {
                permit = new Permit(true, false, Duration.ZERO);
            }
        } finally {
            lock.unlock();
        }
        fireStateChange(transition);
        if (!permit.permitted()) {
            log.debug("Circuit breaker '{}' rejected call, retry after {}", name, permit.retryAfter());
            listeners.forEach(listener -> safely(() -> listener.onRejected(this)));
        }
        return permit;
    }

    private void onSuccess(Permit permit) {
        Transition transition = null;
        lock.lock();
        try {
            totalSuccesses++;
            if (permit.probe()) {
                halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
                if (state == CircuitState.HALF_OPEN) {
                    transition = moveTo(CircuitState.CLOSED, clock.instant());
                    consecutiveFailures = 0;
                    halfOpenInFlight = 0;
                    openedAt = null;
                }
            } else if (state == CircuitState.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
        fireStateChange(transition);
    }

    private void onError(Permit permit, RuntimeException error) {
        if (!settings.recordFailure().test(error)) {
            abandon(permit);
            return;
        }
        Transition transition = null;
        lock.lock();
        try {
            totalFailures++;
            Instant now = clock.instant();
            if (permit.probe()) {
                halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
                if (state == CircuitState.HALF_OPEN) {
                    consecutiveFailures++;
                    transition = moveTo(CircuitState.OPEN, now);
                    openedAt = now;
                    halfOpenInFlight = 0;
                }
            } else if (state == CircuitState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= settings.failureThreshold()) {
                    transition = moveTo(CircuitState.OPEN, now);
                    openedAt = now;
                }
            }
        } finally {
            lock.unlock();
        }
        fireStateChange(transition);
    }

    private void abandon(Permit permit) {
        if (!permit.probe()) {
            return;
        }
        lock.lock();
        try {
            halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
        } finally {
            lock.unlock();
        }
    }

    private Transition moveTo(CircuitState target, Instant now) {
        CircuitState previous = state;
        state = target;
        lastStateChange = now;
        return new Transition(previous, target);
    }

    private Duration retryAfter(Instant now) {
        if (state != CircuitState.OPEN || openedAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = settings.recoveryTimeout().minus(Duration.between(openedAt, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void fireStateChange(Transition transition) {
        if (transition == null) {
            return;
        }
        if (transition.to() == CircuitState.OPEN) {
            log.error("⚡ Circuit breaker '{}' {} -> OPEN", name, transition.from());
        } else {
            log.info("Circuit breaker '{}' {} -> {}", name, transition.from(), transition.to());
        }
        List<CircuitBreakerListener> snapshot = new ArrayList<>(listeners);
        snapshot.forEach(listener -> safely(() -> listener.onStateChange(this, transition.from(), transition.to())));
    }

    private void safely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Circuit breaker '{}' listener failed: {}", name, e.getMessage());
        }
    }

    private record Permit(boolean permitted, boolean probe, Duration retryAfter) {
    }

    private record Transition(CircuitState from, CircuitState to) {
    }
}
