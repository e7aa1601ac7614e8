package com.example.gatekeeper.auth.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Verified claim set of a signed token. {@code familyId} is present on refresh tokens only.
 */
public record TokenClaims(
        @NonNull String userId,
        @NonNull String tenantId,
        @NonNull TokenType type,
        @NonNull String jti,
        @NonNull Instant issuedAt,
        @NonNull Instant expiresAt,
        @NonNull String issuer,
        @Nullable String familyId
) {
}
