package com.example.gatekeeper.auth.context;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * The caller behind a verified access token with a live session.
 */
public record AuthenticatedPrincipal(
        @NonNull String userId,
        @NonNull String tenantId,
        @NonNull String sessionId,
        @NonNull String accessTokenJti,
        @Nullable String ipAddress,
        @Nullable String userAgent
) {
    public static final String EXCHANGE_ATTRIBUTE = AuthenticatedPrincipal.class.getName();
}
