package com.example.gatekeeper.session.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.model.AuditLogEntry;
import com.example.gatekeeper.auth.model.TokenPair;
import com.example.gatekeeper.auth.model.TokenType;
import com.example.gatekeeper.session.model.ClientInfo;
import com.example.gatekeeper.session.model.SessionRevocationReason;
import com.example.gatekeeper.session.model.UserSession;
import com.example.gatekeeper.util.GatekeeperTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionServiceTest {

    private GatekeeperTestHarness harness;
    private SessionService service;

    @BeforeEach
    void setUp() {
        harness = new GatekeeperTestHarness();
        service = harness.sessionService;
        harness.account("u1");
        harness.account("u2");
    }

    private TokenPair signIn(String userId, String tenantId) {
        return harness.tokenLifecycle.issueTokenPair(userId, tenantId, ClientInfo.unknown()).block();
    }

    private UserSession stored(TokenPair pair) {
        return harness.sessionStore.findById(pair.sessionId()).block();
    }

    @Nested
    @DisplayName("logout")
    class Logout {

        @Test
        @DisplayName("should revoke the owner's session and both tokens")
        void shouldRevokeOwnSession() {
            TokenPair pair = signIn("u1", "acme");

            StepVerifier.create(service.logout(pair.sessionId(), "u1"))
                    .expectNext(true)
                    .verifyComplete();

            UserSession session = stored(pair);
            assertThat(session.active()).isFalse();
            assertThat(session.revokedReason()).isEqualTo(SessionRevocationReason.USER_LOGOUT);
            assertThat(session.revokedAt()).isEqualTo(harness.clock.instant());
            StepVerifier.create(harness.tokenService.verifyToken(pair.accessToken().token(), TokenType.ACCESS))
                    .verifyComplete();
            StepVerifier.create(harness.tokenService.verifyToken(pair.refreshToken().token(), TokenType.REFRESH))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to end someone else's session")
        void shouldRefuseNonOwner() {
            TokenPair pair = signIn("u1", "acme");

            StepVerifier.create(service.logout(pair.sessionId(), "u2"))
                    .expectNext(false)
                    .verifyComplete();

            assertThat(stored(pair).active()).isTrue();
        }

        @Test
        @DisplayName("a second logout should report nothing revoked and audit once")
        void shouldBeIdempotent() {
            TokenPair pair = signIn("u1", "acme");

            assertThat(service.logout(pair.sessionId(), "u1").block()).isTrue();
            assertThat(service.logout(pair.sessionId(), "u1").block()).isFalse();

            List<String> types = harness.auditStore.findByScope("acme")
                    .map(AuditLogEntry::eventType).collectList().block();
            assertThat(types).containsOnlyOnce(AuditEventType.SESSION_REVOKED.wireName());
        }

        @Test
        @DisplayName("should report false for an unknown session")
        void shouldHandleUnknownSession() {
            StepVerifier.create(service.logout("missing", "u1"))
                    .expectNext(false)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("revokeFamily")
    class RevokeFamily {

        @Test
        @DisplayName("should revoke the family's session")
        void shouldRevokeFamily() {
            TokenPair pair = signIn("u1", "acme");
            TokenPair other = signIn("u1", "acme");

            StepVerifier.create(service.revokeFamily(pair.familyId()))
                    .expectNext(1L)
                    .verifyComplete();

            assertThat(stored(pair).revokedReason()).isEqualTo(SessionRevocationReason.FAMILY_REVOKED_SECURITY);
            assertThat(stored(other).active()).isTrue();
            assertThat(harness.meterRegistry.get("gatekeeper.session.revoked")
                    .tag("reason", SessionRevocationReason.FAMILY_REVOKED_SECURITY).counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("an administrator should only revoke families of their own tenant")
        void shouldScopeAdminRevocationToTenant() {
            TokenPair pair = signIn("u1", "acme");

            StepVerifier.create(service.revokeFamily(pair.familyId(), "globex"))
                    .expectNext(0L)
                    .verifyComplete();
            assertThat(stored(pair).active()).isTrue();

            StepVerifier.create(service.revokeFamily(pair.familyId(), "acme"))
                    .expectNext(1L)
                    .verifyComplete();
            assertThat(stored(pair).revokedReason()).isEqualTo(SessionRevocationReason.ADMIN_REVOKED);
        }

        @Test
        @DisplayName("an unknown family should revoke nothing")
        void shouldHandleUnknownFamily() {
            StepVerifier.create(service.revokeFamily("no-such-family"))
                    .expectNext(0L)
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("revokeAllForUser should end every active session of the user")
    void shouldRevokeAllForUser() {
        signIn("u1", "acme");
        signIn("u1", "globex");
        TokenPair bystander = signIn("u2", "acme");

        StepVerifier.create(service.revokeAllForUser("u1", SessionRevocationReason.ACCOUNT_DEACTIVATED))
                .expectNext(2L)
                .verifyComplete();

        assertThat(stored(bystander).active()).isTrue();
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("should find the live session of an access token")
        void shouldFindByAccessToken() {
            TokenPair pair = signIn("u1", "acme");

            StepVerifier.create(service.findActiveByAccessToken(pair.accessToken().jti()))
                    .assertNext(session -> assertThat(session.id()).isEqualTo(pair.sessionId()))
                    .verifyComplete();

            service.logout(pair.sessionId(), "u1").block();

            StepVerifier.create(service.findActiveByAccessToken(pair.accessToken().jti())).verifyComplete();
        }

        @Test
        @DisplayName("should list active sessions of one tenant")
        void shouldListActiveSessions() {
            TokenPair acme = signIn("u1", "acme");
            signIn("u1", "globex");
            TokenPair ended = signIn("u1", "acme");
            service.logout(ended.sessionId(), "u1").block();

            StepVerifier.create(service.listActiveSessions("u1", "acme"))
                    .assertNext(session -> assertThat(session.id()).isEqualTo(acme.sessionId()))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("expireSessions")
    class Expiry {

        @Test
        @DisplayName("should expire sessions past their refresh window")
        void shouldExpireOldSessions() {
            TokenPair old = signIn("u1", "acme");
            harness.clock.advance(Duration.ofDays(6));
            TokenPair recent = signIn("u2", "acme");
            harness.clock.advance(Duration.ofDays(2));

            StepVerifier.create(service.expireSessions())
                    .expectNext(1L)
                    .verifyComplete();

            assertThat(stored(old).revokedReason()).isEqualTo(SessionRevocationReason.SESSION_EXPIRED);
            assertThat(stored(recent).active()).isTrue();
            assertThat(harness.auditStore.findByScope("acme").blockLast().eventType())
                    .isEqualTo(AuditEventType.SESSION_EXPIRED.wireName());
        }

        @Test
        @DisplayName("a second sweep should find nothing left")
        void shouldBeIdempotent() {
            signIn("u1", "acme");
            harness.clock.advance(Duration.ofDays(8));

            assertThat(service.expireSessions().block()).isEqualTo(1L);
            assertThat(service.expireSessions().block()).isZero();
        }
    }
}
