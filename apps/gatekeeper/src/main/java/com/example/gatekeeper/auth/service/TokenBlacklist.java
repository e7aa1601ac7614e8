package com.example.gatekeeper.auth.service;

import com.example.gatekeeper.cache.KeyValueStore;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.TokenProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Revoked token ids, kept in the shared key-value store until the token would have expired anyway.
 */
@Slf4j
@Component
public class TokenBlacklist {

    static final String KEY_PREFIX = "blacklist:";
    private static final String MARKER = "1";

    private final KeyValueStore store;
    private final TokenProperties properties;
    private final Clock clock;

    public TokenBlacklist(@NonNull KeyValueStore store, @NonNull TokenProperties properties, @NonNull Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Blacklists {@code jti} until {@code expiresAt}. Repeating the call is a no-op. A token that
     * has already expired needs no entry.
     */
    @NonNull
    public Mono<Void> blacklist(@NonNull String jti, @NonNull Instant expiresAt) {
        Duration remaining = Duration.between(Instant.now(clock), expiresAt);
        if (remaining.isNegative() || remaining.isZero()) {
            return Mono.empty();
        }
        return store.set(KEY_PREFIX + jti, MARKER, remaining)
                .timeout(properties.storeTimeout())
                .doOnSuccess(ok -> log.debug("Token blacklisted: jti={}, ttl={}s",
                        StringSanitizer.mask(jti), remaining.toSeconds()))
                .then();
    }

    /**
     * Whether {@code jti} is revoked. Store errors and timeouts count as revoked.
     */
    @NonNull
    public Mono<Boolean> isBlacklisted(@NonNull String jti) {
        return store.exists(KEY_PREFIX + jti)
                .timeout(properties.storeTimeout())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Blacklist lookup failed, treating token as revoked: jti={}, error={}",
                            StringSanitizer.mask(jti), e.getMessage());
                    return Mono.just(true);
                });
    }
}
