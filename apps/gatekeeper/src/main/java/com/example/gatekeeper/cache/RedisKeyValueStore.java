package com.example.gatekeeper.cache;

import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed key-value store shared by all gatekeeper instances.
 * Errors propagate; callers decide whether a failure means deny or miss.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
public class RedisKeyValueStore implements KeyValueStore {

    private final ReactiveStringRedisTemplate redisTemplate;

    public RedisKeyValueStore(@NonNull ReactiveStringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.info("Redis key-value store initialized (multi-pod mode)");
    }

    @Override
    @NonNull
    public Mono<Boolean> set(@NonNull String key, @NonNull String value, @NonNull Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            return Mono.just(false);
        }
        return redisTemplate.opsForValue().set(key, value, ttl)
                .doOnError(e -> log.warn("Redis SET failed for {}: {}",
                        StringSanitizer.forLog(key), e.getMessage()));
    }

    @Override
    @NonNull
    public Mono<String> get(@NonNull String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    @NonNull
    public Mono<Boolean> exists(@NonNull String key) {
        return redisTemplate.hasKey(key);
    }

    @Override
    @NonNull
    public Mono<Long> increment(@NonNull String key) {
        return redisTemplate.opsForValue().increment(key);
    }

    @Override
    @NonNull
    public Mono<Boolean> delete(@NonNull String key) {
        return redisTemplate.delete(key).map(count -> count > 0);
    }
}
