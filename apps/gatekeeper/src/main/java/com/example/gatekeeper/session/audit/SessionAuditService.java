package com.example.gatekeeper.session.audit;

import com.example.gatekeeper.audit.model.AuditRecord;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Records session lifecycle events on the audit chain and in structured JSON on the audit logger.
 *
 * <p>A failed chain append is logged and does not undo the session change that produced it.
 */
@Service
@RequiredArgsConstructor
public class SessionAuditService {

    // Same logger as AuthzAuditService for unified SIEM ingestion
    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final AuditChainService auditChain;
    private final ObjectMapper objectMapper;

    @NonNull
    public Mono<Void> record(@NonNull SessionAuditEvent event) {
        logEvent(event);
        AuditRecord record = new AuditRecord(event.tenantId(), event.userId(), event.eventType(),
                event.toEventData(), event.ipAddress(), event.userAgent());
        return auditChain.append(record)
                .then()
                .onErrorResume(e -> {
                    AUDIT_LOG.error("Failed to append session event to audit chain: type={}, session={}, error={}",
                            event.eventType().wireName(), StringSanitizer.mask(event.sessionId()),
                            StringSanitizer.forLog(e.getMessage()));
                    return Mono.empty();
                });
    }

    private void logEvent(@NonNull SessionAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case SUCCESS -> AUDIT_LOG.info(json);
                case BLOCKED -> AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize session audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("Session {} - event={}, user={}, reason={}",
                    event.outcome(),
                    event.eventType().wireName(),
                    StringSanitizer.forLog(event.userId()),
                    StringSanitizer.forLog(event.reason()));
        }
    }
}
