package com.example.gatekeeper.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Audit chain append and export limits.
 */
@ConfigurationProperties(prefix = "app.audit")
public record AuditProperties(
        Duration appendTimeout,
        int maxAppendAttempts,
        int exportMaxEntries
) {
    public AuditProperties {
        if (appendTimeout == null) {
            appendTimeout = Duration.ofSeconds(5);
        }
        if (maxAppendAttempts <= 0) {
            maxAppendAttempts = 3;
        }
        if (exportMaxEntries <= 0) {
            exportMaxEntries = 10_000;
        }
    }

    public static AuditProperties defaults() {
        return new AuditProperties(null, 0, 0);
    }
}
