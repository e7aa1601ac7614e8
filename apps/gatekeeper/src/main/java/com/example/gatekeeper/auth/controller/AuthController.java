package com.example.gatekeeper.auth.controller;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.auth.dto.RefreshRequest;
import com.example.gatekeeper.auth.dto.TokenResponse;
import com.example.gatekeeper.auth.exception.AuthenticationException;
import com.example.gatekeeper.auth.service.TokenLifecycleService;
import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.session.model.ClientInfo;
import com.example.gatekeeper.session.service.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final TokenLifecycleService tokenLifecycleService;
    private final SessionService sessionService;
    private final Clock clock;

    /**
     * Exchanges a refresh token for a new pair. The presented token is single-use.
     */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<TokenResponse>> refresh(
            @Valid @RequestBody RefreshRequest request, ServerWebExchange exchange) {
        return tokenLifecycleService.refreshTokens(request.refreshToken(), ClientInfo.from(exchange))
                .map(pair -> ResponseEntity.ok()
                        .cacheControl(CacheControl.noStore())
                        .body(TokenResponse.from(pair, clock.instant())))
                .switchIfEmpty(Mono.error(() -> new AuthenticationException(
                        ErrorResponse.Codes.REFRESH_REJECTED, "Refresh token rejected")));
    }

    @PostMapping("/logout")
    public Mono<ResponseEntity<Map<String, Object>>> logout(AuthenticatedPrincipal principal) {
        return sessionService.logout(principal.sessionId(), principal.userId())
                .map(loggedOut -> ResponseEntity.ok(Map.<String, Object>of("logged_out", loggedOut)));
    }
}
