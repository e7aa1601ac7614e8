package com.example.gatekeeper.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response format for all API errors.
 *
 * <pre>{@code
 * {
 *   "error": "access_denied",
 *   "code": "PERMISSION_DENIED",
 *   "message": "Access denied",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "path": "/api/v1/audit/verify",
 *   "details": {
 *     "required": "audit_log:read"
 *   }
 * }
 * }</pre>
 *
 * @param error         Stable error category for client error handling
 * @param code          Specific error code for debugging/logging
 * @param message       Human-readable message
 * @param correlationId Request correlation ID for tracing
 * @param timestamp     When the error occurred
 * @param path          Request path that triggered the error
 * @param details       Additional context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String correlationId,
        Instant timestamp,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, null);
    }

    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path,
            Map<String, Object> details
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, details);
    }

    /**
     * Common error categories.
     */
    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String AUTHENTICATION_REQUIRED = "authentication_required";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String CONFLICT = "conflict";
        public static final String NOT_FOUND = "not_found";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        // Authentication
        public static final String TOKEN_MISSING = "TOKEN_MISSING";
        public static final String TOKEN_INVALID = "TOKEN_INVALID";
        public static final String SESSION_INACTIVE = "SESSION_INACTIVE";
        public static final String REFRESH_REJECTED = "REFRESH_REJECTED";

        // Authorization
        public static final String PERMISSION_DENIED = "PERMISSION_DENIED";

        // Administration
        public static final String ROLE_HIERARCHY_INVALID = "ROLE_HIERARCHY_INVALID";
        public static final String PERMISSION_INVALID = "PERMISSION_INVALID";
        public static final String POLICY_INVALID = "POLICY_INVALID";
        public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";

        // Validation
        public static final String INVALID_REQUEST = "INVALID_REQUEST";

        public static final String INTERNAL = "INTERNAL";

        private Codes() {
        }
    }
}
