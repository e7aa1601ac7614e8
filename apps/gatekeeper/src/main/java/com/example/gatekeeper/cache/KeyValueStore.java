package com.example.gatekeeper.cache;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Low-latency shared key-value store holding token blacklist entries and cached policy decisions.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link InMemoryKeyValueStore} - single-pod deployments (default)</li>
 *   <li>{@link RedisKeyValueStore} - multi-pod deployments</li>
 * </ul>
 *
 * <p>All writes are idempotent: writing the same key and value twice leaves the store in the same state.
 */
public interface KeyValueStore {

    /**
     * Stores a value that expires after {@code ttl}.
     */
    @NonNull
    Mono<Boolean> set(@NonNull String key, @NonNull String value, @NonNull Duration ttl);

    /**
     * Returns the value, or empty when absent or expired.
     */
    @NonNull
    Mono<String> get(@NonNull String key);

    @NonNull
    Mono<Boolean> exists(@NonNull String key);

    /**
     * Atomically increments a counter, creating it at 1. Counters never expire.
     */
    @NonNull
    Mono<Long> increment(@NonNull String key);

    @NonNull
    Mono<Boolean> delete(@NonNull String key);
}
