package com.golden.controlplane.service.idempotency;

import com.golden.controlplane.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store: {@code SET key value NX EX ttl} is the atomic claim and Redis expires entries.
 */
@Slf4j
public class RedisIdempotencyStore implements IdempotencyStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisIdempotencyStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(keyPrefix + key));
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency lookup failed for " + key, e);
        }
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        try {
            Boolean stored = redisTemplate.opsForValue().setIfAbsent(keyPrefix + key, value, ttl);
            if (!Boolean.TRUE.equals(stored)) {
                log.debug("Idempotency key already held: {}", key);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency claim failed for " + key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency write failed for " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redisTemplate.delete(keyPrefix + key);
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency delete failed for " + key, e);
        }
    }
}
