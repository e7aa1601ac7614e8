package com.example.gatekeeper.audit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Outcome of replaying a chain. When broken, {@code brokenAtIndex} is the 0-based index of
 * the first bad entry and {@code brokenAtPosition} its 1-based position.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainVerificationResult(
        boolean valid,
        int checkedCount,
        @Nullable Integer brokenAtIndex,
        @Nullable Integer brokenAtPosition,
        @Nullable FailureType failure,
        @Nullable String entryId,
        @Nullable Instant firstTimestamp,
        @Nullable Instant lastTimestamp
) {
    public enum FailureType {
        /** Stored hash differs from the hash recomputed from the entry's payload. */
        HASH_MISMATCH,
        /** previous_hash does not equal the prior entry's current_hash. */
        LINK_BROKEN
    }

    public static ChainVerificationResult intact(int checkedCount, Instant first, Instant last) {
        return new ChainVerificationResult(true, checkedCount, null, null, null, null, first, last);
    }

    public static ChainVerificationResult broken(int index, FailureType failure, AuditLogEntry entry,
                                                 Instant first) {
        return new ChainVerificationResult(false, index + 1, index, index + 1, failure,
                entry.id(), first, entry.timestamp());
    }
}
