package com.example.gatekeeper.auth.filter;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.auth.context.PrincipalContextHolder;
import com.example.gatekeeper.auth.model.TokenClaims;
import com.example.gatekeeper.auth.model.TokenType;
import com.example.gatekeeper.auth.service.TokenService;
import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.filter.FilterResponseUtils;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.session.model.ClientInfo;
import com.example.gatekeeper.session.model.UserSession;
import com.example.gatekeeper.session.service.SessionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Authenticates {@code Authorization: Bearer} access tokens.
 *
 * <p>A request is authenticated only when the token verifies and its session is still active.
 * The resulting {@link AuthenticatedPrincipal} is stored on the exchange and in the Reactor context.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final SessionService sessionService;
    private final ObjectMapper objectMapper;

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        String token = extractToken(exchange);
        if (token == null) {
            return FilterResponseUtils.unauthorized(exchange, ErrorResponse.Codes.TOKEN_MISSING,
                    "Bearer token required", objectMapper);
        }

        // Resolve before chaining so downstream failures are not reported as 401
        return tokenService.verifyToken(token, TokenType.ACCESS)
                .flatMap(claims -> resolveSession(claims)
                        .map(session -> AuthResult.authenticated(toPrincipal(claims, session, exchange)))
                        .defaultIfEmpty(AuthResult.rejected(ErrorResponse.Codes.SESSION_INACTIVE,
                                "Session is no longer active")))
                .defaultIfEmpty(AuthResult.rejected(ErrorResponse.Codes.TOKEN_INVALID,
                        "Invalid or expired access token"))
                .flatMap(result -> {
                    if (result.principal() == null) {
                        log.debug("Rejected request to {}: {}",
                                StringSanitizer.forLog(exchange.getRequest().getPath().value()), result.code());
                        return FilterResponseUtils.unauthorized(exchange, result.code(), result.message(), objectMapper);
                    }
                    AuthenticatedPrincipal principal = result.principal();
                    exchange.getAttributes().put(AuthenticatedPrincipal.EXCHANGE_ATTRIBUTE, principal);
                    return chain.filter(exchange)
                            .contextWrite(PrincipalContextHolder.withPrincipal(principal));
                });
    }

    private Mono<UserSession> resolveSession(TokenClaims claims) {
        return sessionService.findActiveByAccessToken(claims.jti())
                .filter(session -> session.userId().equals(claims.userId())
                        && session.tenantId().equals(claims.tenantId()))
                .onErrorResume(e -> {
                    log.warn("Session lookup failed, rejecting token: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private static AuthenticatedPrincipal toPrincipal(TokenClaims claims, UserSession session,
                                                      ServerWebExchange exchange) {
        ClientInfo client = ClientInfo.from(exchange);
        return new AuthenticatedPrincipal(claims.userId(), claims.tenantId(), session.id(), claims.jti(),
                client.ipAddress(), client.userAgent());
    }

    @Nullable
    static String extractToken(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private record AuthResult(@Nullable AuthenticatedPrincipal principal, String code, String message) {
        static AuthResult authenticated(AuthenticatedPrincipal principal) {
            return new AuthResult(principal, null, null);
        }

        static AuthResult rejected(String code, String message) {
            return new AuthResult(null, code, message);
        }
    }
}
