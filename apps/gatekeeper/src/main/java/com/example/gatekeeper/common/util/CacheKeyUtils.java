package com.example.gatekeeper.common.util;

import org.springframework.lang.NonNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility methods for cache key handling.
 */
public final class CacheKeyUtils {

    private CacheKeyUtils() {}

    /**
     * Sanitizes a cache key segment by replacing the delimiter, whitespace and control characters.
     *
     * @throws IllegalArgumentException if key is null or blank
     */
    @NonNull
    public static String sanitize(@NonNull String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be null or blank");
        }
        return key.replaceAll("[:\\s\\n\\r\\t]", "_");
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of the value.
     */
    @NonNull
    public static String sha256Hex(@NonNull String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm must be available in JVM", e);
        }
    }
}
