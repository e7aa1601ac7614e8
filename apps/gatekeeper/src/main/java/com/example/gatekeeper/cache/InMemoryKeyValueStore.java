package com.example.gatekeeper.cache;

import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.MemoryCacheProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Caffeine-backed key-value store for single-pod deployments.
 * Each entry carries its own time-to-live.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Cache<String, Entry> cache;

    @Autowired
    public InMemoryKeyValueStore(@NonNull MemoryCacheProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    public InMemoryKeyValueStore(@NonNull MemoryCacheProperties properties, @NonNull Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.maxEntries())
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .build();
        log.info("In-memory key-value store initialized (maxEntries={})", properties.maxEntries());
    }

    @Override
    @NonNull
    public Mono<Boolean> set(@NonNull String key, @NonNull String value, @NonNull Duration ttl) {
        return Mono.fromCallable(() -> {
            if (ttl.isNegative() || ttl.isZero()) {
                cache.invalidate(key);
                return false;
            }
            cache.put(key, new Entry(value, ttl.toNanos()));
            log.trace("Stored key {}", StringSanitizer.forLog(key));
            return true;
        });
    }

    @Override
    @NonNull
    public Mono<String> get(@NonNull String key) {
        return Mono.fromCallable(() -> {
            Entry entry = cache.getIfPresent(key);
            return entry != null ? entry.value() : null;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> exists(@NonNull String key) {
        return Mono.fromCallable(() -> cache.getIfPresent(key) != null);
    }

    @Override
    @NonNull
    public Mono<Long> increment(@NonNull String key) {
        return Mono.fromCallable(() -> {
            Entry updated = cache.asMap().compute(key, (k, current) -> {
                long next = current == null ? 1L : Long.parseLong(current.value()) + 1L;
                return new Entry(Long.toString(next), Long.MAX_VALUE);
            });
            return Long.parseLong(updated.value());
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> delete(@NonNull String key) {
        return Mono.fromCallable(() -> cache.asMap().remove(key) != null);
    }

    private record Entry(String value, long ttlNanos) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
