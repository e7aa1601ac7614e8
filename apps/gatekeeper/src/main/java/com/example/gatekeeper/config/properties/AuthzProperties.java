package com.example.gatekeeper.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        Duration storeTimeout,
        DecisionCacheProperties decisionCache,
        RoleCacheProperties roleCache,
        AuditProperties audit
) {
    public AuthzProperties {
        if (storeTimeout == null) {
            storeTimeout = Duration.ofSeconds(2);
        }
        if (decisionCache == null) {
            decisionCache = new DecisionCacheProperties(true, Duration.ofSeconds(300));
        }
        if (roleCache == null) {
            roleCache = new RoleCacheProperties(10_000, null);
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
    }

    public record DecisionCacheProperties(
            boolean enabled,
            Duration ttl
    ) {
        public DecisionCacheProperties {
            if (ttl == null) {
                ttl = Duration.ofSeconds(300);
            }
        }
    }

    /**
     * Resolved role permission cache; evictions are broadcast on {@code channel} in redis mode.
     */
    public record RoleCacheProperties(
            long maxSize,
            String channel
    ) {
        public RoleCacheProperties {
            if (maxSize <= 0) {
                maxSize = 10_000;
            }
            if (channel == null || channel.isBlank()) {
                channel = "gatekeeper:cache:role:events";
            }
        }
    }

    /**
     * Whether decisions are also appended to the audit chain.
     */
    public record AuditProperties(
            boolean enabled
    ) {}

    public static AuthzProperties defaults() {
        return new AuthzProperties(null, null, null, null);
    }
}
