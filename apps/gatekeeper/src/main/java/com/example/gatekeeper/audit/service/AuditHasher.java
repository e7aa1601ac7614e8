package com.example.gatekeeper.audit.service;

import com.example.gatekeeper.common.json.CanonicalJson;
import com.example.gatekeeper.common.util.CacheKeyUtils;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Computes entry hashes: SHA-256 over previous hash, canonical event data, event type and
 * timestamp, joined with {@code |}.
 */
@Component
public class AuditHasher {

    public static final String GENESIS = "genesis";

    private static final String SEPARATOR = "|";

    @NonNull
    public String hash(@NonNull String previousHash,
                       @Nullable Map<String, Object> eventData,
                       @NonNull String eventType,
                       @NonNull Instant timestamp) {
        String material = previousHash
                + SEPARATOR + CanonicalJson.write(eventData)
                + SEPARATOR + eventType
                + SEPARATOR + timestamp;
        return CacheKeyUtils.sha256Hex(material);
    }
}
