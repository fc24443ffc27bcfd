package com.golden.controlplane.service.idempotency;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value cache with expiry. {@link #putIfAbsent} must be atomic across every process that
 * shares the store.
 */
public interface IdempotencyStore {

    Optional<String> get(String key);

    /**
     * @return true if this caller stored the value, false if a live entry already existed
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    void put(String key, String value, Duration ttl);

    void remove(String key);
}
