package com.example.gatekeeper.auth.dto;

import com.example.gatekeeper.auth.model.TokenPair;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Token pair as returned to clients. {@code expiresIn} is the access token lifetime in seconds.
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("session_id") String sessionId
) {
    public static final String BEARER = "Bearer";

    public static TokenResponse from(TokenPair pair, Instant now) {
        long expiresIn = Math.max(0, Duration.between(now, pair.accessToken().expiresAt()).getSeconds());
        return new TokenResponse(
                pair.accessToken().token(),
                pair.refreshToken().token(),
                BEARER,
                expiresIn,
                pair.sessionId());
    }
}
