package com.example.gatekeeper.session.model;

import com.example.gatekeeper.common.util.ClientIpExtractor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;

/**
 * Client address and user agent recorded on sessions and audit entries.
 */
public record ClientInfo(
        @Nullable String ipAddress,
        @Nullable String userAgent
) {
    private static final int MAX_HEADER_LENGTH = 500;

    private static final ClientInfo UNKNOWN = new ClientInfo(null, null);

    @NonNull
    public static ClientInfo of(@Nullable String ipAddress, @Nullable String userAgent) {
        return new ClientInfo(sanitizeHeader(ipAddress), sanitizeHeader(userAgent));
    }

    @NonNull
    public static ClientInfo from(@NonNull ServerWebExchange exchange) {
        return of(ClientIpExtractor.extract(exchange), ClientIpExtractor.userAgent(exchange));
    }

    @NonNull
    public static ClientInfo unknown() {
        return UNKNOWN;
    }

    /**
     * Removes control characters and limits length.
     */
    @Nullable
    private static String sanitizeHeader(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", " ")
                .trim();
        if (sanitized.length() > MAX_HEADER_LENGTH) {
            sanitized = sanitized.substring(0, MAX_HEADER_LENGTH);
        }
        return sanitized.isBlank() ? null : sanitized;
    }
}
