package com.example.gatekeeper.session.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * One signed-in session. Exactly one session exists per refresh token family; refresh rotation
 * replaces the jti pair in place.
 */
@Document("sessions")
public record UserSession(
        @Id String id,
        @Indexed String userId,
        String tenantId,
        @Indexed(unique = true) String accessTokenJti,
        @Indexed(unique = true) String refreshTokenJti,
        @Indexed String refreshTokenFamily,
        boolean active,
        Instant accessTokenExpiresAt,
        Instant expiresAt,
        Instant createdAt,
        Instant lastActivityAt,
        @Nullable Instant revokedAt,
        @Nullable String revokedReason,
        @Nullable String ipAddress,
        @Nullable String userAgent
) {

    /**
     * Copy carrying a new token pair, stamped with {@code now} as last activity.
     */
    @NonNull
    public UserSession rotate(
            @NonNull String newAccessJti,
            @NonNull Instant newAccessExpiresAt,
            @NonNull String newRefreshJti,
            @NonNull Instant newExpiresAt,
            @NonNull Instant now) {
        return new UserSession(id, userId, tenantId, newAccessJti, newRefreshJti, refreshTokenFamily,
                active, newAccessExpiresAt, newExpiresAt, createdAt, now, revokedAt, revokedReason,
                ipAddress, userAgent);
    }

    @NonNull
    public UserSession revoke(@NonNull String reason, @NonNull Instant now) {
        return new UserSession(id, userId, tenantId, accessTokenJti, refreshTokenJti, refreshTokenFamily,
                false, accessTokenExpiresAt, expiresAt, createdAt, lastActivityAt, now, reason,
                ipAddress, userAgent);
    }

    public boolean isExpiredAt(@NonNull Instant now) {
        return !expiresAt.isAfter(now);
    }
}
