package com.example.gatekeeper.session.service;

import com.example.gatekeeper.auth.service.TokenBlacklist;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.TokenProperties;
import com.example.gatekeeper.observability.metrics.GatekeeperMetrics;
import com.example.gatekeeper.session.audit.SessionAuditEvent;
import com.example.gatekeeper.session.audit.SessionAuditService;
import com.example.gatekeeper.session.model.SessionRevocationReason;
import com.example.gatekeeper.session.model.UserSession;
import com.example.gatekeeper.session.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Session termination: logout, family revocation, per-user revocation and the expiry sweep.
 *
 * <p>Every termination deactivates the session with a conditional update, blacklists both of its
 * token ids for their remaining lifetime and records one audit entry. A session that is already
 * inactive is left untouched, so concurrent terminations audit it once.
 */
@Slf4j
@Service
public class SessionService {

    private final SessionStore sessionStore;
    private final TokenBlacklist blacklist;
    private final SessionAuditService auditService;
    private final GatekeeperMetrics metrics;
    private final TokenProperties tokenProperties;
    private final Clock clock;

    public SessionService(
            @NonNull SessionStore sessionStore,
            @NonNull TokenBlacklist blacklist,
            @NonNull SessionAuditService auditService,
            @NonNull GatekeeperMetrics metrics,
            @NonNull TokenProperties tokenProperties,
            @NonNull Clock clock) {
        this.sessionStore = sessionStore;
        this.blacklist = blacklist;
        this.auditService = auditService;
        this.metrics = metrics;
        this.tokenProperties = tokenProperties;
        this.clock = clock;
    }

    /**
     * Ends {@code sessionId} on behalf of {@code userId}. Only the session's owner may end it.
     *
     * @return true if the session was active and is now revoked
     */
    @NonNull
    public Mono<Boolean> logout(@NonNull String sessionId, @NonNull String userId) {
        return sessionStore.findById(sessionId)
                .timeout(tokenProperties.storeTimeout())
                .flatMap(session -> {
                    if (!session.userId().equals(userId)) {
                        log.warn("Logout rejected, caller does not own session: session={}, caller={}",
                                StringSanitizer.mask(sessionId), StringSanitizer.forLog(userId));
                        return Mono.just(false);
                    }
                    return terminate(session, SessionRevocationReason.USER_LOGOUT);
                })
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.error("Logout failed: session={}, error={}", StringSanitizer.mask(sessionId), e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Revokes every session of a refresh token family.
     *
     * @return number of sessions that were active and are now revoked
     */
    @NonNull
    public Mono<Long> revokeFamily(@NonNull String familyId) {
        return sessionStore.findByFamily(familyId)
                .concatMap(session -> terminate(session, SessionRevocationReason.FAMILY_REVOKED_SECURITY))
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> log.warn("Token family revoked: family={}, sessions={}",
                        StringSanitizer.mask(familyId), count));
    }

    /**
     * Revokes a refresh token family on behalf of an administrator of {@code tenantId}.
     * Sessions of other tenants in the family are left untouched.
     *
     * @return number of sessions that were active and are now revoked
     */
    @NonNull
    public Mono<Long> revokeFamily(@NonNull String familyId, @NonNull String tenantId) {
        return sessionStore.findByFamily(familyId)
                .filter(session -> session.tenantId().equals(tenantId))
                .concatMap(session -> terminate(session, SessionRevocationReason.ADMIN_REVOKED))
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> log.warn("Token family revoked by admin: family={}, tenant={}, sessions={}",
                        StringSanitizer.mask(familyId), StringSanitizer.forLog(tenantId), count));
    }

    /**
     * Active, unexpired sessions of {@code userId} within {@code tenantId}.
     */
    @NonNull
    public Flux<UserSession> listActiveSessions(@NonNull String userId, @NonNull String tenantId) {
        Instant now = Instant.now(clock);
        return sessionStore.findActiveByUser(userId)
                .timeout(tokenProperties.storeTimeout())
                .filter(session -> session.tenantId().equals(tenantId) && !session.isExpiredAt(now));
    }

    /**
     * Revokes every active session of a user, for example after account deactivation.
     */
    @NonNull
    public Mono<Long> revokeAllForUser(@NonNull String userId, @NonNull String reason) {
        return sessionStore.findActiveByUser(userId)
                .concatMap(session -> terminate(session, reason))
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> log.info("Revoked {} sessions for user {} ({})",
                        count, StringSanitizer.forLog(userId), reason));
    }

    /**
     * The active, unexpired session owning access token {@code accessTokenJti}.
     */
    @NonNull
    public Mono<UserSession> findActiveByAccessToken(@NonNull String accessTokenJti) {
        Instant now = Instant.now(clock);
        return sessionStore.findByAccessTokenJti(accessTokenJti)
                .timeout(tokenProperties.storeTimeout())
                .filter(session -> session.active() && !session.isExpiredAt(now));
    }

    /**
     * Deactivates sessions whose refresh window has passed.
     *
     * @return number of sessions expired
     */
    @NonNull
    public Mono<Long> expireSessions() {
        return sessionStore.findActiveExpiredBefore(Instant.now(clock))
                .concatMap(session -> terminate(session, SessionRevocationReason.SESSION_EXPIRED))
                .filter(Boolean::booleanValue)
                .count();
    }

    @Scheduled(fixedDelayString = "${app.session.cleanup-interval:PT5M}")
    public void scheduledExpirySweep() {
        expireSessions().subscribe(
                count -> {
                    if (count > 0) {
                        log.info("Expired {} sessions", count);
                    }
                },
                e -> log.warn("Session expiry sweep failed: {}", e.getMessage()));
    }

    @NonNull
    Mono<Boolean> terminate(@NonNull UserSession session, @NonNull String reason) {
        return sessionStore.deactivate(session.id(), reason, Instant.now(clock))
                .timeout(tokenProperties.storeTimeout())
                .flatMap(revoked -> blacklist.blacklist(revoked.accessTokenJti(), revoked.accessTokenExpiresAt())
                        .then(blacklist.blacklist(revoked.refreshTokenJti(), revoked.expiresAt()))
                        .then(auditService.record(SessionAuditEvent.revoked(revoked, reason)))
                        .doOnSuccess(v -> {
                            metrics.recordSessionRevoked(reason);
                            log.info("Session revoked: session={}, reason={}", StringSanitizer.mask(revoked.id()), reason);
                        })
                        .thenReturn(true))
                .defaultIfEmpty(false);
    }
}
