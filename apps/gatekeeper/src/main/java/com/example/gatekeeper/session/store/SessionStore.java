package com.example.gatekeeper.session.store;

import com.example.gatekeeper.session.model.UserSession;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable session records, the source of truth for revocation.
 *
 * <p>{@link #rotate} and {@link #deactivate} are conditional updates on a single session: of two
 * concurrent callers with the same expectation, exactly one observes a result.
 */
public interface SessionStore {

    @NonNull
    Mono<UserSession> save(@NonNull UserSession session);

    @NonNull
    Mono<UserSession> findById(@NonNull String sessionId);

    @NonNull
    Mono<UserSession> findByRefreshTokenJti(@NonNull String refreshTokenJti);

    @NonNull
    Mono<UserSession> findByAccessTokenJti(@NonNull String accessTokenJti);

    @NonNull
    Flux<UserSession> findByFamily(@NonNull String familyId);

    @NonNull
    Flux<UserSession> findActiveByUser(@NonNull String userId);

    /**
     * Active sessions whose refresh window ended at or before {@code cutoff}.
     */
    @NonNull
    Flux<UserSession> findActiveExpiredBefore(@NonNull Instant cutoff);

    /**
     * Replaces the stored session with {@code rotated} only if it is still active and still holds
     * {@code expectedRefreshJti}.
     *
     * @return the stored rotated session, or empty if the expectation no longer holds
     */
    @NonNull
    Mono<UserSession> rotate(@NonNull String expectedRefreshJti, @NonNull UserSession rotated);

    /**
     * Marks the session inactive if it is currently active.
     *
     * @return the deactivated session, or empty if it was missing or already inactive
     */
    @NonNull
    Mono<UserSession> deactivate(@NonNull String sessionId, @NonNull String reason, @NonNull Instant at);
}
