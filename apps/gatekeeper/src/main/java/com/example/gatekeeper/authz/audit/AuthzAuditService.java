package com.example.gatekeeper.authz.audit;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.model.AuditRecord;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.AuthzProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Publishes authorization decisions: one structured JSON line on the {@code AUTHZ_AUDIT} logger and
 * one {@code authorization_checked} entry on the tenant's audit chain.
 *
 * <p>Audit failures are logged and never change the decision.
 */
@Service
@RequiredArgsConstructor
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final AuditChainService auditChain;
    private final AuthzProperties properties;
    private final ObjectMapper objectMapper;

    @NonNull
    public Mono<Void> record(@NonNull AuthzAuditEvent event) {
        logEvent(event);
        if (!properties.audit().enabled()) {
            return Mono.empty();
        }
        AuditRecord record = new AuditRecord(event.organizationId(), event.principalId(),
                AuditEventType.AUTHORIZATION_CHECKED, event.toEventData(), event.clientIp(), event.userAgent());
        return auditChain.append(record)
                .then()
                .onErrorResume(e -> {
                    AUDIT_LOG.error("Failed to append authorization decision to audit chain: user={}, error={}",
                            StringSanitizer.forLog(event.principalId()), StringSanitizer.forLog(e.getMessage()));
                    return Mono.empty();
                });
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case ALLOW -> AUDIT_LOG.info(json);
                case DENY -> AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - user={}, resource={}/{}, action={}, source={}",
                event.outcome(),
                StringSanitizer.forLog(event.principalId()),
                StringSanitizer.forLog(event.resourceType()),
                StringSanitizer.forLog(event.resourceId()),
                StringSanitizer.forLog(event.action()),
                event.source());
    }
}
