package com.example.gatekeeper.common.exception;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.util.StringSanitizer;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Maps domain and validation failures onto {@link ErrorResponse}; storage and
 * infrastructure error text is logged but never returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    @ExceptionHandler(GatekeeperException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleDomain(
            @NonNull GatekeeperException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Request rejected: code={}, message={}", ex.getCode(), StringSanitizer.forLog(ex.getMessage(), 200));
        return ResponseEntity.status(ex.getStatus())
                .body(ErrorResponse.of(ex.getCategory(), ex.getCode(), ex.getMessage(),
                        exchange.getRequest().getId(), path(exchange)));
    }

    /**
     * Handles validation errors from {@code @Valid} request bodies.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            @NonNull WebExchangeBindException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", sanitizeResponseMessage(error.getDefaultMessage())))
                .collect(Collectors.toList());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorResponse.Categories.VALIDATION_ERROR,
                        ErrorResponse.Codes.INVALID_REQUEST, "Request validation failed",
                        exchange.getRequest().getId(), path(exchange), Map.of("fields", fieldErrors)));
    }

    @ExceptionHandler({ConstraintViolationException.class, ServerWebInputException.class,
            IllegalArgumentException.class})
    @NonNull
    public ResponseEntity<ErrorResponse> handleBadInput(
            @NonNull Exception ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getMessage(), 200));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorResponse.Categories.VALIDATION_ERROR,
                        ErrorResponse.Codes.INVALID_REQUEST, "Invalid request",
                        exchange.getRequest().getId(), path(exchange)));
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(
            @NonNull Exception ex, @NonNull ServerWebExchange exchange) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage(), 200), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorResponse.Categories.INTERNAL_ERROR,
                        ErrorResponse.Codes.INTERNAL, "An unexpected error occurred",
                        exchange.getRequest().getId(), path(exchange)));
    }

    @NonNull
    private String path(@NonNull ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }

    @NonNull
    private String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 50));
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message.replace("\n", " ").replace("\r", " ").replace("\t", " ");
        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
