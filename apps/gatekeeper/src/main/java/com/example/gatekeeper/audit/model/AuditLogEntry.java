package com.example.gatekeeper.audit.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * One link of a hash chain. {@code chainScope} is the tenant id, or {@code global} for
 * events without a tenant; {@code sequence} starts at 1 per scope.
 *
 * <p>Event data values are restricted to strings, numbers, booleans, lists and maps so that the
 * canonical form survives a storage round trip unchanged.
 */
@Document(collection = "audit_log")
@CompoundIndex(name = "scope_sequence_idx", def = "{'chainScope': 1, 'sequence': 1}", unique = true)
public record AuditLogEntry(
        @Id String id,
        String chainScope,
        long sequence,
        @Nullable String tenantId,
        @Nullable String userId,
        String eventType,
        Map<String, Object> eventData,
        @Nullable String ipAddress,
        @Nullable String userAgent,
        Instant timestamp,
        String previousHash,
        String currentHash
) {
}
