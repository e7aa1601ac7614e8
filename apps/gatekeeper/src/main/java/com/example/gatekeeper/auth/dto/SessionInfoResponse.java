package com.example.gatekeeper.auth.dto;

import com.example.gatekeeper.session.model.UserSession;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Session summary for the caller's own sessions. Token ids are never exposed.
 */
public record SessionInfoResponse(
        String sessionId,
        String tenantId,
        boolean current,
        @Nullable String ipAddress,
        @Nullable String userAgent,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt
) {
    public static SessionInfoResponse from(UserSession session, @Nullable String currentSessionId) {
        return new SessionInfoResponse(
                session.id(),
                session.tenantId(),
                session.id().equals(currentSessionId),
                session.ipAddress(),
                session.userAgent(),
                session.createdAt(),
                session.lastActivityAt(),
                session.expiresAt()
        );
    }
}
