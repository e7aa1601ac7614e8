package com.example.gatekeeper.authz.pubsub;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Role permission cache invalidation, published via Redis pub/sub to propagate evictions across pods.
 */
public record RoleCacheEventMessage(
        @NonNull EventType eventType,
        @NonNull String roleId,
        @NonNull Instant timestamp,
        @Nullable String sourceInstanceId
) {
    public enum EventType {
        EVICT,
        EVICT_ALL
    }

    public static RoleCacheEventMessage evict(String roleId, String instanceId) {
        return new RoleCacheEventMessage(EventType.EVICT, roleId, Instant.now(), instanceId);
    }

    public static RoleCacheEventMessage evictAll(String instanceId) {
        return new RoleCacheEventMessage(EventType.EVICT_ALL, "*", Instant.now(), instanceId);
    }
}
