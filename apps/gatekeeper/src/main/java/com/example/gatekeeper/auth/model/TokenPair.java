package com.example.gatekeeper.auth.model;

import org.springframework.lang.NonNull;

/**
 * Access and refresh token bound to one session.
 */
public record TokenPair(
        @NonNull String sessionId,
        @NonNull IssuedToken accessToken,
        @NonNull IssuedToken refreshToken
) {
    @NonNull
    public String familyId() {
        return refreshToken.familyId();
    }
}
