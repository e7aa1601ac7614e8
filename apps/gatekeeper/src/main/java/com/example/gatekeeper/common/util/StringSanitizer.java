package com.example.gatekeeper.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 100;
    private static final int DEFAULT_HEADER_MAX_LENGTH = 500;
    private static final int MASK_VISIBLE_CHARS = 8;

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.:-]{1,128}$");

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Masks a token identifier or session id for logging, keeping only its prefix.
     */
    @NonNull
    public static String mask(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = forLog(value);
        if (sanitized.length() <= MASK_VISIBLE_CHARS) {
            return "***";
        }
        return sanitized.substring(0, MASK_VISIBLE_CHARS) + "...";
    }

    @NonNull
    public static String escapeJson(@NonNull String value) {
        return value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    @Nullable
    public static String headerValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", " ")
                .trim();
        if (trimmed.length() > DEFAULT_HEADER_MAX_LENGTH) {
            return trimmed.substring(0, DEFAULT_HEADER_MAX_LENGTH);
        }
        return trimmed;
    }

    public static boolean isValidSafeId(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(id).matches();
    }
}
