package com.example.gatekeeper.session.controller;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.auth.dto.SessionInfoResponse;
import com.example.gatekeeper.authz.annotation.RequiresPermission;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.session.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @GetMapping
    public Mono<ResponseEntity<List<SessionInfoResponse>>> listOwnSessions(AuthenticatedPrincipal principal) {
        return sessionService.listActiveSessions(principal.userId(), principal.tenantId())
                .map(session -> SessionInfoResponse.from(session, principal.sessionId()))
                .sort(Comparator.comparing(SessionInfoResponse::createdAt).reversed())
                .collectList()
                .map(ResponseEntity::ok);
    }

    /**
     * Revokes every session of a refresh token family within the caller's organization.
     */
    @PostMapping("/families/{familyId}/revoke")
    @RequiresPermission(resource = "session", action = "admin")
    public Mono<ResponseEntity<Map<String, Object>>> revokeFamily(
            @PathVariable String familyId, AuthenticatedPrincipal principal) {
        if (!StringSanitizer.isValidSafeId(familyId)) {
            return Mono.error(new IllegalArgumentException("Invalid family id"));
        }
        log.info("Family revocation requested by {}: family={}",
                StringSanitizer.forLog(principal.userId()), StringSanitizer.mask(familyId));
        return sessionService.revokeFamily(familyId, principal.tenantId())
                .map(count -> ResponseEntity.ok(Map.<String, Object>of("revoked_sessions", count)));
    }
}
