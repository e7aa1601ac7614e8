package com.example.gatekeeper.auth.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A freshly signed token together with the identifiers needed to track it.
 */
public record IssuedToken(
        @NonNull String token,
        @NonNull String jti,
        @Nullable String familyId,
        @NonNull Instant expiresAt
) {
}
