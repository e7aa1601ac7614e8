package com.example.gatekeeper.common.filter;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes {@link ErrorResponse} bodies directly from WebFilters, before any handler runs.
 */
@Slf4j
public final class FilterResponseUtils {

    private static final String BEARER_CHALLENGE = "Bearer realm=\"gatekeeper\"";

    private FilterResponseUtils() {}

    /**
     * 401 with a Bearer challenge header.
     */
    @NonNull
    public static Mono<Void> unauthorized(
            @NonNull ServerWebExchange exchange,
            @NonNull String code,
            @NonNull String message,
            @Nullable ObjectMapper objectMapper) {
        exchange.getResponse().getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        return write(exchange, HttpStatus.UNAUTHORIZED, ErrorResponse.Categories.AUTHENTICATION_REQUIRED,
                code, message, null, objectMapper);
    }

    /**
     * 403 carrying the permission that was required.
     */
    @NonNull
    public static Mono<Void> forbidden(
            @NonNull ServerWebExchange exchange,
            @NonNull String code,
            @NonNull String message,
            @Nullable Map<String, Object> details,
            @Nullable ObjectMapper objectMapper) {
        return write(exchange, HttpStatus.FORBIDDEN, ErrorResponse.Categories.ACCESS_DENIED,
                code, message, details, objectMapper);
    }

    @NonNull
    public static Mono<Void> write(
            @NonNull ServerWebExchange exchange,
            @NonNull HttpStatus status,
            @NonNull String error,
            @NonNull String code,
            @NonNull String message,
            @Nullable Map<String, Object> details,
            @Nullable ObjectMapper objectMapper) {

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        String path = exchange.getRequest().getPath().value();
        String correlationId = exchange.getRequest().getId();
        ErrorResponse response = ErrorResponse.of(error, code, message, correlationId, path, details);

        String body = null;
        if (objectMapper != null) {
            try {
                body = objectMapper.writeValueAsString(response);
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize error response: {}", StringSanitizer.forLog(e.getMessage()));
            }
        }
        if (body == null) {
            body = "{\"error\":\"" + StringSanitizer.escapeJson(error)
                    + "\",\"code\":\"" + StringSanitizer.escapeJson(code)
                    + "\",\"message\":\"" + StringSanitizer.escapeJson(message)
                    + "\",\"correlationId\":\"" + StringSanitizer.escapeJson(correlationId) + "\"}";
        }

        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return exchange.getResponse()
                .writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(bytes)));
    }
}
