package com.example.gatekeeper.common.util;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetSocketAddress;
import java.util.regex.Pattern;

/**
 * Extracts the client IP address of a request, honouring X-Forwarded-For only when
 * the direct peer is a private-network proxy.
 */
public final class ClientIpExtractor {

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final String UNKNOWN = "unknown";
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private ClientIpExtractor() {}

    @NonNull
    public static String extract(@NonNull ServerWebExchange exchange) {
        return extract(exchange.getRequest());
    }

    @NonNull
    public static String extract(@NonNull ServerHttpRequest request) {
        InetSocketAddress remoteAddress = request.getRemoteAddress();
        String directIp = remoteAddress != null && remoteAddress.getAddress() != null
                ? remoteAddress.getAddress().getHostAddress()
                : UNKNOWN;

        if (isTrustedProxy(directIp)) {
            String forwardedFor = request.getHeaders().getFirst(X_FORWARDED_FOR);
            if (forwardedFor != null && !forwardedFor.isBlank()) {
                // Rightmost untrusted hop is the client
                String[] ips = forwardedFor.split(",");
                for (int i = ips.length - 1; i >= 0; i--) {
                    String ip = ips[i].trim();
                    if (!isTrustedProxy(ip) && isValidIp(ip)) {
                        return ip;
                    }
                }
            }
        }
        return directIp;
    }

    @Nullable
    public static String userAgent(@NonNull ServerWebExchange exchange) {
        return StringSanitizer.headerValue(exchange.getRequest().getHeaders().getFirst("User-Agent"));
    }

    static boolean isValidIp(@Nullable String ip) {
        return ip != null && IP_ADDRESS_PATTERN.matcher(ip).matches();
    }

    private static boolean isTrustedProxy(@NonNull String ip) {
        return ip.startsWith("10.")
                || ip.startsWith("192.168.")
                || ip.matches("^172\\.(1[6-9]|2[0-9]|3[01])\\..*")
                || ip.equals("127.0.0.1")
                || ip.equals("0:0:0:0:0:0:0:1")
                || ip.equals("::1");
    }
}
