package com.example.gatekeeper.audit.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * An event waiting to be appended to the chain.
 */
public record AuditRecord(
        @Nullable String tenantId,
        @Nullable String userId,
        @NonNull AuditEventType eventType,
        @NonNull Map<String, Object> eventData,
        @Nullable String ipAddress,
        @Nullable String userAgent
) {
    public AuditRecord {
        eventData = eventData == null ? Map.of() : Map.copyOf(eventData);
    }

    public static AuditRecord of(String tenantId, String userId, AuditEventType eventType,
                                 Map<String, Object> eventData) {
        return new AuditRecord(tenantId, userId, eventType, eventData, null, null);
    }

    public AuditRecord withClient(@Nullable String ipAddress, @Nullable String userAgent) {
        return new AuditRecord(tenantId, userId, eventType, eventData, ipAddress, userAgent);
    }
}
