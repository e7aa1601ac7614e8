package com.example.gatekeeper.audit.controller;

import com.example.gatekeeper.audit.model.AuditLogEntry;
import com.example.gatekeeper.audit.model.ChainVerificationResult;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.authz.annotation.RequiresPermission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the caller organization's audit chain.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditChainService auditChainService;

    @GetMapping("/verify")
    @RequiresPermission(resource = "audit_log", action = "read")
    public Mono<ResponseEntity<ChainVerificationResult>> verify(AuthenticatedPrincipal principal) {
        return auditChainService.verifyStoredChain(principal.tenantId())
                .doOnNext(result -> {
                    if (!result.valid()) {
                        log.error("Audit chain broken for tenant {} at position {}",
                                principal.tenantId(), result.brokenAtPosition());
                    }
                })
                .map(ResponseEntity::ok);
    }

    @GetMapping("/entries")
    @RequiresPermission(resource = "audit_log", action = "read")
    public Mono<ResponseEntity<List<AuditLogEntry>>> entries(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            AuthenticatedPrincipal principal) {
        return auditChainService.export(principal.tenantId(), from, to)
                .collectList()
                .map(ResponseEntity::ok);
    }
}
