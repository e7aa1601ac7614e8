package com.example.gatekeeper.authz.controller;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.authz.dto.AuthorizationCheckRequest;
import com.example.gatekeeper.authz.dto.AuthorizationCheckResponse;
import com.example.gatekeeper.authz.dto.EffectivePermissionsResponse;
import com.example.gatekeeper.authz.model.AuthorizationRequest;
import com.example.gatekeeper.authz.service.AuthorizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/authz")
@RequiredArgsConstructor
public class AuthorizationController {

    private static final String CONTEXT_CLIENT_IP = "client_ip";
    private static final String CONTEXT_USER_AGENT = "user_agent";

    private final AuthorizationService authorizationService;

    /**
     * Evaluates an access question for the caller in the caller's organization.
     * Client address and user agent come from the connection, not the request body.
     */
    @PostMapping("/check")
    public Mono<ResponseEntity<AuthorizationCheckResponse>> check(
            @Valid @RequestBody AuthorizationCheckRequest request, AuthenticatedPrincipal principal) {
        Map<String, Object> context = new HashMap<>();
        if (request.context() != null) {
            request.context().forEach((key, value) -> {
                if (value != null) {
                    context.put(key, value);
                }
            });
        }
        context.remove(CONTEXT_CLIENT_IP);
        context.remove(CONTEXT_USER_AGENT);
        if (principal.ipAddress() != null) {
            context.put(CONTEXT_CLIENT_IP, principal.ipAddress());
        }
        if (principal.userAgent() != null) {
            context.put(CONTEXT_USER_AGENT, principal.userAgent());
        }

        AuthorizationRequest authzRequest = new AuthorizationRequest(principal.userId(), principal.tenantId(),
                request.resourceType(), request.action(), request.resourceId(), context);
        return authorizationService.authorize(authzRequest)
                .map(decision -> ResponseEntity.ok(AuthorizationCheckResponse.from(decision)));
    }

    @GetMapping("/permissions")
    public Mono<ResponseEntity<EffectivePermissionsResponse>> permissions(AuthenticatedPrincipal principal) {
        return authorizationService.getEffectivePermissions(principal.userId(), principal.tenantId())
                .map(permissions -> ResponseEntity.ok(new EffectivePermissionsResponse(
                        principal.tenantId(), permissions.stream().sorted().toList())));
    }
}
