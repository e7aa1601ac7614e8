package com.example.gatekeeper.auth.filter;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.auth.context.PrincipalContextHolder;
import com.example.gatekeeper.auth.model.IssuedToken;
import com.example.gatekeeper.auth.model.TokenPair;
import com.example.gatekeeper.session.model.ClientInfo;
import com.example.gatekeeper.util.GatekeeperTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokenAuthenticationFilterTest {

    private GatekeeperTestHarness harness;
    private BearerTokenAuthenticationFilter filter;
    private AtomicReference<AuthenticatedPrincipal> seenPrincipal;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        harness = new GatekeeperTestHarness();
        harness.account("u1");
        filter = new BearerTokenAuthenticationFilter(harness.tokenService, harness.sessionService,
                harness.objectMapper);
        seenPrincipal = new AtomicReference<>();
        chain = exchange -> PrincipalContextHolder.getPrincipal()
                .doOnNext(seenPrincipal::set)
                .then();
    }

    private MockServerWebExchange exchange(String authorization) {
        MockServerHttpRequest.BaseBuilder<?> request = MockServerHttpRequest.get("/api/v1/authz/permissions")
                .header(HttpHeaders.USER_AGENT, "junit");
        if (authorization != null) {
            request.header(HttpHeaders.AUTHORIZATION, authorization);
        }
        return MockServerWebExchange.from(request);
    }

    private TokenPair signIn() {
        return harness.tokenLifecycle.issueTokenPair("u1", "acme", ClientInfo.unknown()).block();
    }

    private void assertRejected(MockServerWebExchange exchange, String code) {
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exchange.getResponse().getBodyAsString().block()).contains("\"code\":\"" + code + "\"");
        assertThat(seenPrincipal.get()).isNull();
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("should reject a request without a bearer token")
        void shouldRejectMissingToken() {
            MockServerWebExchange exchange = exchange(null);

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertRejected(exchange, "TOKEN_MISSING");
        }

        @Test
        @DisplayName("should reject an invalid token")
        void shouldRejectInvalidToken() {
            MockServerWebExchange exchange = exchange("Bearer not-a-token");

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertRejected(exchange, "TOKEN_INVALID");
        }

        @Test
        @DisplayName("should reject a refresh token used as access token")
        void shouldRejectRefreshToken() {
            MockServerWebExchange exchange = exchange("Bearer " + signIn().refreshToken().token());

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertRejected(exchange, "TOKEN_INVALID");
        }

        @Test
        @DisplayName("should reject a valid token without a live session")
        void shouldRejectTokenWithoutSession() {
            IssuedToken orphan = harness.tokenService.issueAccessToken("u1", "acme");
            MockServerWebExchange exchange = exchange("Bearer " + orphan.token());

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertRejected(exchange, "SESSION_INACTIVE");
        }

        @Test
        @DisplayName("should reject the access token of a logged-out session")
        void shouldRejectAfterLogout() {
            TokenPair pair = signIn();
            harness.sessionService.logout(pair.sessionId(), "u1").block();
            MockServerWebExchange exchange = exchange("Bearer " + pair.accessToken().token());

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertRejected(exchange, "TOKEN_INVALID");
        }
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        @DisplayName("should expose the principal on the exchange and in the context")
        void shouldAuthenticate() {
            TokenPair pair = signIn();
            MockServerWebExchange exchange = exchange("Bearer " + pair.accessToken().token());

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            AuthenticatedPrincipal principal = seenPrincipal.get();
            assertThat(principal).isNotNull();
            assertThat(principal.userId()).isEqualTo("u1");
            assertThat(principal.tenantId()).isEqualTo("acme");
            assertThat(principal.sessionId()).isEqualTo(pair.sessionId());
            assertThat(principal.userAgent()).isEqualTo("junit");
            assertThat((AuthenticatedPrincipal) exchange.getAttribute(AuthenticatedPrincipal.EXCHANGE_ATTRIBUTE))
                    .isEqualTo(principal);
            assertThat(exchange.getResponse().getStatusCode()).isNull();
        }

        @Test
        @DisplayName("should not turn downstream errors into 401")
        void shouldPropagateDownstreamErrors() {
            MockServerWebExchange exchange = exchange("Bearer " + signIn().accessToken().token());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.error(new IllegalStateException("boom"))))
                    .expectErrorMessage("boom")
                    .verify();
        }
    }

    @Test
    @DisplayName("extractToken should accept any case of the scheme")
    void shouldExtractToken() {
        assertThat(BearerTokenAuthenticationFilter.extractToken(exchange("bearer abc"))).isEqualTo("abc");
        assertThat(BearerTokenAuthenticationFilter.extractToken(exchange("Bearer   "))).isNull();
        assertThat(BearerTokenAuthenticationFilter.extractToken(exchange("Basic dXNlcg=="))).isNull();
    }
}
