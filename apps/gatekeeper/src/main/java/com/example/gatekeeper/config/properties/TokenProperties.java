package com.example.gatekeeper.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Signed token settings. Issuer and audience are enforced on verification.
 */
@ConfigurationProperties(prefix = "app.token")
public record TokenProperties(
        String issuer,
        String audience,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration storeTimeout,
        int keyRetention
) {
    public TokenProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "gatekeeper";
        }
        if (audience == null || audience.isBlank()) {
            audience = "gatekeeper-api";
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(15);
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = Duration.ofDays(7);
        }
        if (storeTimeout == null) {
            storeTimeout = Duration.ofSeconds(2);
        }
        if (keyRetention <= 0) {
            keyRetention = 2;
        }
    }

    public static TokenProperties defaults() {
        return new TokenProperties(null, null, null, null, null, 0);
    }
}
