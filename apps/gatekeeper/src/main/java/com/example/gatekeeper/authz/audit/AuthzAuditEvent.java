package com.example.gatekeeper.authz.audit;

import com.example.gatekeeper.authz.model.AuthorizationDecision;
import com.example.gatekeeper.authz.model.AuthorizationRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured audit event for one authorization decision.
 */
public record AuthzAuditEvent(
        Instant timestamp,

        // Decision
        Outcome outcome,
        AuthorizationDecision.Source source,
        List<String> reasons,

        // Subject
        String principalId,
        @Nullable String organizationId,

        // Resource
        String resourceType,
        @Nullable String resourceId,
        String action,
        List<String> requestedPermissions,

        // Request context
        @Nullable String clientIp,
        @Nullable String userAgent
) {
    public enum Outcome {
        ALLOW, DENY
    }

    static final String CONTEXT_CLIENT_IP = "client_ip";
    static final String CONTEXT_USER_AGENT = "user_agent";

    public AuthzAuditEvent {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        requestedPermissions = requestedPermissions == null ? List.of() : List.copyOf(requestedPermissions);
    }

    public static AuthzAuditEvent from(
            @NonNull AuthorizationRequest request,
            @NonNull AuthorizationDecision decision,
            @NonNull Instant timestamp) {
        return new AuthzAuditEvent(
                timestamp,
                decision.allowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.source(),
                decision.reasons(),
                request.principalId(),
                request.organizationId(),
                request.resourceType(),
                request.resourceId(),
                request.action(),
                List.of(),
                stringOrNull(request.context().get(CONTEXT_CLIENT_IP)),
                stringOrNull(request.context().get(CONTEXT_USER_AGENT)));
    }

    /**
     * Event for an any/all permission-set check.
     */
    public static AuthzAuditEvent permissionCheck(
            @NonNull String principalId,
            @Nullable String organizationId,
            @NonNull String mode,
            @NonNull List<String> requestedPermissions,
            @NonNull AuthorizationDecision decision,
            @NonNull Instant timestamp) {
        return new AuthzAuditEvent(
                timestamp,
                decision.allowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.source(),
                decision.reasons(),
                principalId,
                organizationId,
                "permissions",
                null,
                mode,
                requestedPermissions,
                null,
                null);
    }

    /**
     * Payload hashed into the audit chain. Absent values are left out.
     */
    @NonNull
    public Map<String, Object> toEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("decision", outcome == Outcome.ALLOW ? "allow" : "deny");
        data.put("source", source.name());
        data.put("principal", principalId);
        data.put("resource", resourceType);
        if (resourceId != null) {
            data.put("resource_id", resourceId);
        }
        data.put("action", action);
        data.put("reasons", reasons);
        if (!requestedPermissions.isEmpty()) {
            data.put("permissions", requestedPermissions);
        }
        return data;
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("source", source.name()),
                Map.entry("reasons", reasons),
                Map.entry("user_id", principalId != null ? principalId : ""),
                Map.entry("organization_id", organizationId != null ? organizationId : ""),
                Map.entry("resource_type", resourceType != null ? resourceType : ""),
                Map.entry("resource_id", resourceId != null ? resourceId : ""),
                Map.entry("action", action != null ? action : ""),
                Map.entry("permissions", requestedPermissions),
                Map.entry("client_ip", clientIp != null ? clientIp : ""),
                Map.entry("user_agent", userAgent != null ? userAgent : "")
        );
    }

    @Nullable
    private static String stringOrNull(@Nullable Object value) {
        return value == null ? null : value.toString();
    }
}
