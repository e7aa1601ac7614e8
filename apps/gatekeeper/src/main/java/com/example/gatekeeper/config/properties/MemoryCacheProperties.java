package com.example.gatekeeper.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for in-memory cache limits.
 * Used when app.cache.type=memory (default).
 */
@ConfigurationProperties(prefix = "app.cache.memory")
public record MemoryCacheProperties(
        int maxEntries
) {
    public MemoryCacheProperties {
        if (maxEntries <= 0) {
            maxEntries = 100_000;
        }
    }

    /**
     * Default properties with reasonable limits for single-pod deployment.
     */
    public static MemoryCacheProperties defaults() {
        return new MemoryCacheProperties(100_000);
    }
}
