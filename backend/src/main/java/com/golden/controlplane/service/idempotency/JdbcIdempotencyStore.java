package com.golden.controlplane.service.idempotency;

import com.golden.controlplane.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Idempotency records in the relational store. The primary key on {@code cache_key} makes the
 * insert the atomic claim; expired rows are deleted before the insert so they never block a new claim.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "control-plane.idempotency.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcIdempotencyStore implements IdempotencyStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public Optional<String> get(String key) {
        try {
            List<String> values = jdbcTemplate.queryForList(
                    "SELECT cache_value FROM idempotency_records WHERE cache_key = ? AND expires_at > ?",
                    String.class, key, Timestamp.from(Instant.now(clock)));
            return values.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency lookup failed for " + key, e);
        }
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        Instant now = Instant.now(clock);
        try {
            jdbcTemplate.update("DELETE FROM idempotency_records WHERE cache_key = ? AND expires_at <= ?",
                    key, Timestamp.from(now));
            jdbcTemplate.update(
                    "INSERT INTO idempotency_records (cache_key, cache_value, expires_at, created_at) VALUES (?, ?, ?, ?)",
                    key, value, Timestamp.from(now.plus(ttl)), Timestamp.from(now));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Idempotency key already held: {}", key);
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency claim failed for " + key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant now = Instant.now(clock);
        try {
            int updated = jdbcTemplate.update(
                    "UPDATE idempotency_records SET cache_value = ?, expires_at = ? WHERE cache_key = ?",
                    value, Timestamp.from(now.plus(ttl)), key);
            if (updated == 0) {
                try {
                    jdbcTemplate.update(
                            "INSERT INTO idempotency_records (cache_key, cache_value, expires_at, created_at) VALUES (?, ?, ?, ?)",
                            key, value, Timestamp.from(now.plus(ttl)), Timestamp.from(now));
                } catch (DataIntegrityViolationException raced) {
                    jdbcTemplate.update("UPDATE idempotency_records SET cache_value = ?, expires_at = ? WHERE cache_key = ?",
                            value, Timestamp.from(now.plus(ttl)), key);
                }
            }
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency write failed for " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            jdbcTemplate.update("DELETE FROM idempotency_records WHERE cache_key = ?", key);
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency delete failed for " + key, e);
        }
    }

    public int purgeExpired() {
        try {
            return jdbcTemplate.update("DELETE FROM idempotency_records WHERE expires_at <= ?",
                    Timestamp.from(Instant.now(clock)));
        } catch (DataAccessException e) {
            throw new StorageException("Idempotency purge failed", e);
        }
    }
}
