package com.example.gatekeeper.session.store;

import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.session.model.UserSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Single-node session store. Conditional updates run inside {@link ConcurrentHashMap#computeIfPresent},
 * which is atomic per key.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, UserSession> sessions = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public Mono<UserSession> save(@NonNull UserSession session) {
        return Mono.fromSupplier(() -> {
            sessions.put(session.id(), session);
            log.debug("Saved session: {}", StringSanitizer.mask(session.id()));
            return session;
        });
    }

    @Override
    @NonNull
    public Mono<UserSession> findById(@NonNull String sessionId) {
        return Mono.fromSupplier(() -> sessions.get(sessionId));
    }

    @Override
    @NonNull
    public Mono<UserSession> findByRefreshTokenJti(@NonNull String refreshTokenJti) {
        return first(session -> refreshTokenJti.equals(session.refreshTokenJti()));
    }

    @Override
    @NonNull
    public Mono<UserSession> findByAccessTokenJti(@NonNull String accessTokenJti) {
        return first(session -> accessTokenJti.equals(session.accessTokenJti()));
    }

    @Override
    @NonNull
    public Flux<UserSession> findByFamily(@NonNull String familyId) {
        return all(session -> familyId.equals(session.refreshTokenFamily()));
    }

    @Override
    @NonNull
    public Flux<UserSession> findActiveByUser(@NonNull String userId) {
        return all(session -> session.active() && userId.equals(session.userId()));
    }

    @Override
    @NonNull
    public Flux<UserSession> findActiveExpiredBefore(@NonNull Instant cutoff) {
        return all(session -> session.active() && session.isExpiredAt(cutoff));
    }

    @Override
    @NonNull
    public Mono<UserSession> rotate(@NonNull String expectedRefreshJti, @NonNull UserSession rotated) {
        return Mono.fromSupplier(() -> {
            UserSession[] applied = new UserSession[1];
            sessions.computeIfPresent(rotated.id(), (id, current) -> {
                if (!current.active() || !expectedRefreshJti.equals(current.refreshTokenJti())) {
                    return current;
                }
                applied[0] = rotated;
                return rotated;
            });
            return applied[0];
        });
    }

    @Override
    @NonNull
    public Mono<UserSession> deactivate(@NonNull String sessionId, @NonNull String reason, @NonNull Instant at) {
        return Mono.fromSupplier(() -> {
            UserSession[] applied = new UserSession[1];
            sessions.computeIfPresent(sessionId, (id, current) -> {
                if (!current.active()) {
                    return current;
                }
                applied[0] = current.revoke(reason, at);
                return applied[0];
            });
            return applied[0];
        });
    }

    private Mono<UserSession> first(Predicate<UserSession> predicate) {
        return Mono.fromSupplier(() -> sessions.values().stream()
                .filter(predicate)
                .findFirst()
                .orElse(null));
    }

    private Flux<UserSession> all(Predicate<UserSession> predicate) {
        return Flux.defer(() -> Flux.fromStream(sessions.values().stream().filter(predicate)));
    }
}
