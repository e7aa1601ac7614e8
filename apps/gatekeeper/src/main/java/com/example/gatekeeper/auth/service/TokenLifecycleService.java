package com.example.gatekeeper.auth.service;

import com.example.gatekeeper.auth.exception.TokenIssuanceException;
import com.example.gatekeeper.auth.model.IssuedToken;
import com.example.gatekeeper.auth.model.TokenClaims;
import com.example.gatekeeper.auth.model.TokenPair;
import com.example.gatekeeper.auth.model.TokenType;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.TokenProperties;
import com.example.gatekeeper.identity.model.UserAccount;
import com.example.gatekeeper.identity.store.UserAccountStore;
import com.example.gatekeeper.observability.metrics.GatekeeperMetrics;
import com.example.gatekeeper.session.audit.SessionAuditEvent;
import com.example.gatekeeper.session.audit.SessionAuditService;
import com.example.gatekeeper.session.model.ClientInfo;
import com.example.gatekeeper.session.model.UserSession;
import com.example.gatekeeper.session.service.SessionService;
import com.example.gatekeeper.session.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Token pair issuance and refresh rotation.
 *
 * <p>A refresh token is single-use. Presenting a valid refresh token that no longer belongs to an
 * active session (already rotated, lost a concurrent rotation, or its session was logged out or
 * expired) is treated as replay: the whole token family is revoked and the attempt fails.
 */
@Slf4j
@Service
public class TokenLifecycleService {

    private final TokenService tokenService;
    private final SessionStore sessionStore;
    private final SessionService sessionService;
    private final SessionAuditService sessionAudit;
    private final UserAccountStore userAccountStore;
    private final GatekeeperMetrics metrics;
    private final TokenProperties properties;
    private final Clock clock;

    public TokenLifecycleService(
            @NonNull TokenService tokenService,
            @NonNull SessionStore sessionStore,
            @NonNull SessionService sessionService,
            @NonNull SessionAuditService sessionAudit,
            @NonNull UserAccountStore userAccountStore,
            @NonNull GatekeeperMetrics metrics,
            @NonNull TokenProperties properties,
            @NonNull Clock clock) {
        this.tokenService = tokenService;
        this.sessionStore = sessionStore;
        this.sessionService = sessionService;
        this.sessionAudit = sessionAudit;
        this.userAccountStore = userAccountStore;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues a token pair under a new family and creates its session. Called after a successful sign-in.
     *
     * @throws TokenIssuanceException (as an error signal) for unknown or inactive accounts and storage failures
     */
    @NonNull
    public Mono<TokenPair> issueTokenPair(@NonNull String userId, @NonNull String tenantId, @NonNull ClientInfo client) {
        return activeAccount(userId)
                .switchIfEmpty(Mono.error(() -> new TokenIssuanceException("Account is unknown or inactive")))
                .flatMap(account -> {
                    IssuedToken access = tokenService.issueAccessToken(userId, tenantId);
                    IssuedToken refresh = tokenService.issueRefreshToken(userId, tenantId, null);
                    Instant now = Instant.now(clock);
                    UserSession session = new UserSession(
                            UUID.randomUUID().toString(),
                            userId,
                            tenantId,
                            access.jti(),
                            refresh.jti(),
                            refresh.familyId(),
                            true,
                            access.expiresAt(),
                            refresh.expiresAt(),
                            now,
                            now,
                            null,
                            null,
                            client.ipAddress(),
                            client.userAgent());
                    return sessionStore.save(session)
                            .timeout(properties.storeTimeout())
                            .flatMap(saved -> sessionAudit.record(SessionAuditEvent.created(saved))
                                    .thenReturn(new TokenPair(saved.id(), access, refresh)));
                })
                .doOnNext(pair -> {
                    metrics.recordSessionCreated();
                    log.info("Session created: user={}, session={}", StringSanitizer.forLog(userId),
                            StringSanitizer.mask(pair.sessionId()));
                })
                .onErrorMap(e -> !(e instanceof TokenIssuanceException),
                        e -> new TokenIssuanceException("Session could not be created", e));
    }

    /**
     * Exchanges a refresh token for a new pair in the same family.
     *
     * @return the new pair, or empty if the token is invalid, replayed, or its owner is inactive
     */
    @NonNull
    public Mono<TokenPair> refreshTokens(@Nullable String refreshToken, @NonNull ClientInfo client) {
        return tokenService.verifyToken(refreshToken, TokenType.REFRESH)
                .flatMap(claims -> sessionStore.findByRefreshTokenJti(claims.jti())
                        .timeout(properties.storeTimeout())
                        .filter(UserSession::active)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(found -> found.isPresent()
                                ? rotate(found.get(), claims, client)
                                : handleReplay(claims, client)))
                .doOnNext(pair -> metrics.recordRefresh(true))
                .switchIfEmpty(Mono.defer(() -> {
                    metrics.recordRefresh(false);
                    return Mono.empty();
                }))
                .onErrorResume(e -> {
                    log.error("Token refresh failed: {}", e.getMessage());
                    metrics.recordRefresh(false);
                    return Mono.empty();
                });
    }

    private Mono<TokenPair> rotate(UserSession session, TokenClaims claims, ClientInfo client) {
        if (!session.userId().equals(claims.userId())) {
            log.warn("Refresh rejected for mismatched session: session={}",
                    StringSanitizer.mask(session.id()));
            return Mono.empty();
        }
        return activeAccount(session.userId())
                .hasElement()
                .flatMap(accountActive -> {
                    if (!accountActive) {
                        log.warn("Refresh rejected, account inactive: user={}",
                                StringSanitizer.forLog(session.userId()));
                        return Mono.<TokenPair>empty();
                    }
                    IssuedToken access = tokenService.issueAccessToken(session.userId(), session.tenantId());
                    IssuedToken refresh = tokenService.issueRefreshToken(
                            session.userId(), session.tenantId(), session.refreshTokenFamily());
                    UserSession rotated = session.rotate(access.jti(), access.expiresAt(),
                            refresh.jti(), refresh.expiresAt(), Instant.now(clock));

                    return sessionStore.rotate(claims.jti(), rotated)
                            .timeout(properties.storeTimeout())
                            .flatMap(stored -> sessionAudit.record(SessionAuditEvent.refreshed(stored))
                                    .thenReturn(new TokenPair(stored.id(), access, refresh)))
                            // Another caller rotated this token first
                            .switchIfEmpty(Mono.defer(() -> handleReplay(claims, client)));
                });
    }

    private Mono<TokenPair> handleReplay(TokenClaims claims, ClientInfo client) {
        log.warn("Refresh token replay detected: user={}, family={}, jti={}",
                StringSanitizer.forLog(claims.userId()), StringSanitizer.mask(claims.familyId()),
                StringSanitizer.mask(claims.jti()));
        metrics.recordReplay();
        return sessionService.revokeFamily(claims.familyId())
                .then(Mono.defer(() -> sessionAudit.record(SessionAuditEvent.replayDetected(claims.tenantId(),
                        claims.userId(), claims.familyId(), client.ipAddress(), client.userAgent()))))
                .then(Mono.<TokenPair>empty());
    }

    private Mono<UserAccount> activeAccount(String userId) {
        return userAccountStore.findById(userId)
                .timeout(properties.storeTimeout())
                .filter(UserAccount::active);
    }
}
