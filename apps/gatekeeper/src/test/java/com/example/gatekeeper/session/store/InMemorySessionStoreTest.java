package com.example.gatekeeper.session.store;

import com.example.gatekeeper.session.model.UserSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySessionStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private InMemorySessionStore store;
    private UserSession session;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        session = new UserSession("s1", "u1", "acme", "a1", "r1", "f1", true,
                NOW.plus(Duration.ofMinutes(15)), NOW.plus(Duration.ofDays(7)), NOW, NOW, null, null, null, null);
        store.save(session).block();
    }

    private UserSession rotated(String accessJti, String refreshJti) {
        return session.rotate(accessJti, NOW.plus(Duration.ofMinutes(30)), refreshJti, NOW.plus(Duration.ofDays(8)),
                NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    @DisplayName("rotate should apply when the expected refresh jti still holds")
    void shouldRotateOnMatch() {
        StepVerifier.create(store.rotate("r1", rotated("a2", "r2")))
                .assertNext(result -> assertThat(result.refreshTokenJti()).isEqualTo("r2"))
                .verifyComplete();

        StepVerifier.create(store.findByRefreshTokenJti("r2"))
                .assertNext(found -> assertThat(found.accessTokenJti()).isEqualTo("a2"))
                .verifyComplete();
        StepVerifier.create(store.findByRefreshTokenJti("r1")).verifyComplete();
    }

    @Test
    @DisplayName("only one of two rotations with the same expectation should apply")
    void shouldRotateOnlyOnce() {
        store.rotate("r1", rotated("a2", "r2")).block();

        StepVerifier.create(store.rotate("r1", rotated("a3", "r3"))).verifyComplete();
        assertThat(store.findById("s1").block().refreshTokenJti()).isEqualTo("r2");
    }

    @Test
    @DisplayName("rotate should not revive an inactive session")
    void shouldNotRotateInactive() {
        store.deactivate("s1", "user_logout", NOW).block();

        StepVerifier.create(store.rotate("r1", rotated("a2", "r2"))).verifyComplete();
        assertThat(store.findById("s1").block().active()).isFalse();
    }

    @Test
    @DisplayName("deactivate should apply once")
    void shouldDeactivateOnce() {
        StepVerifier.create(store.deactivate("s1", "user_logout", NOW))
                .assertNext(result -> {
                    assertThat(result.active()).isFalse();
                    assertThat(result.revokedReason()).isEqualTo("user_logout");
                    assertThat(result.revokedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
        StepVerifier.create(store.deactivate("s1", "admin_revoked", NOW)).verifyComplete();
        StepVerifier.create(store.deactivate("missing", "admin_revoked", NOW)).verifyComplete();
    }

    @Test
    @DisplayName("should find sessions whose refresh window has ended")
    void shouldFindExpired() {
        StepVerifier.create(store.findActiveExpiredBefore(NOW.plus(Duration.ofDays(1)))).verifyComplete();
        StepVerifier.create(store.findActiveExpiredBefore(NOW.plus(Duration.ofDays(7))))
                .expectNextCount(1)
                .verifyComplete();
    }
}
