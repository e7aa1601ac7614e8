package com.example.gatekeeper.session.audit;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.session.model.SessionRevocationReason;
import com.example.gatekeeper.session.model.UserSession;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session lifecycle event, recorded on the tenant's audit chain and mirrored to the audit logger.
 */
public record SessionAuditEvent(
        @NonNull AuditEventType eventType,
        @NonNull Outcome outcome,
        @Nullable String tenantId,
        @Nullable String userId,
        @Nullable String sessionId,
        @Nullable String familyId,
        @Nullable String reason,
        @Nullable String ipAddress,
        @Nullable String userAgent
) {
    public enum Outcome {
        SUCCESS, BLOCKED
    }

    public static SessionAuditEvent created(UserSession session) {
        return of(AuditEventType.SESSION_CREATED, Outcome.SUCCESS, session, null);
    }

    public static SessionAuditEvent refreshed(UserSession session) {
        return of(AuditEventType.SESSION_REFRESHED, Outcome.SUCCESS, session, null);
    }

    /**
     * Session termination. Expiry sweeps are reported as {@code session_expired}.
     */
    public static SessionAuditEvent revoked(UserSession session, String reason) {
        AuditEventType type = SessionRevocationReason.SESSION_EXPIRED.equals(reason)
                ? AuditEventType.SESSION_EXPIRED
                : AuditEventType.SESSION_REVOKED;
        return of(type, Outcome.SUCCESS, session, reason);
    }

    public static SessionAuditEvent replayDetected(
            String tenantId, String userId, String familyId,
            @Nullable String ipAddress, @Nullable String userAgent) {
        return new SessionAuditEvent(AuditEventType.TOKEN_REPLAY_DETECTED, Outcome.BLOCKED,
                tenantId, userId, null, familyId, "refresh_token_reuse", ipAddress, userAgent);
    }

    private static SessionAuditEvent of(AuditEventType type, Outcome outcome, UserSession session,
                                        @Nullable String reason) {
        return new SessionAuditEvent(type, outcome, session.tenantId(), session.userId(), session.id(),
                session.refreshTokenFamily(), reason, session.ipAddress(), session.userAgent());
    }

    /**
     * Payload hashed into the audit chain.
     */
    @NonNull
    public Map<String, Object> toEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (sessionId != null) {
            data.put("session_id", sessionId);
        }
        if (familyId != null) {
            data.put("family_id", familyId);
        }
        if (reason != null) {
            data.put("reason", reason);
        }
        return data;
    }

    @NonNull
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", eventType.wireName()),
                Map.entry("outcome", outcome.name()),
                Map.entry("tenant_id", tenantId != null ? tenantId : ""),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("session_id", sessionId != null ? sessionId : ""),
                Map.entry("family_id", familyId != null ? familyId : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("client_ip", ipAddress != null ? ipAddress : "")
        );
    }
}
