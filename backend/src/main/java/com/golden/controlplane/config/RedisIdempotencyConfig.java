package com.golden.controlplane.config;

import com.golden.controlplane.service.idempotency.IdempotencyStore;
import com.golden.controlplane.service.idempotency.RedisIdempotencyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@Slf4j
@ConditionalOnProperty(name = "control-plane.idempotency.store", havingValue = "redis")
public class RedisIdempotencyConfig {

    @Bean
    public IdempotencyStore redisIdempotencyStore(StringRedisTemplate redisTemplate, ControlPlaneProperties properties) {
        log.info("Using Redis idempotency store with prefix '{}'", properties.getIdempotency().getKeyPrefix());
        return new RedisIdempotencyStore(redisTemplate, properties.getIdempotency().getKeyPrefix());
    }
}
