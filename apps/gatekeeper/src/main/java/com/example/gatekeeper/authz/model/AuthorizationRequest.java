package com.example.gatekeeper.authz.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * One access question: may {@code principalId} perform {@code action} on {@code resourceType}
 * (optionally a single {@code resourceId}) within {@code organizationId}?
 *
 * <p>{@code context} carries request attributes for policy conditions, for example
 * {@code client_ip} and {@code mfa_verified}.
 */
public record AuthorizationRequest(
        @NonNull String principalId,
        @Nullable String organizationId,
        @NonNull String resourceType,
        @NonNull String action,
        @Nullable String resourceId,
        @NonNull Map<String, Object> context
) {
    public AuthorizationRequest {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static AuthorizationRequest of(String principalId, String organizationId,
                                          String resourceType, String action) {
        return new AuthorizationRequest(principalId, organizationId, resourceType, action, null, Map.of());
    }

    public AuthorizationRequest withResourceId(@Nullable String resourceId) {
        return new AuthorizationRequest(principalId, organizationId, resourceType, action, resourceId, context);
    }

    public AuthorizationRequest withOrganization(@Nullable String organizationId) {
        return new AuthorizationRequest(principalId, organizationId, resourceType, action, resourceId, context);
    }

    public AuthorizationRequest withContext(@NonNull Map<String, Object> context) {
        return new AuthorizationRequest(principalId, organizationId, resourceType, action, resourceId, context);
    }

    /**
     * The resource string policies match against: {@code type} or {@code type:id}.
     */
    @NonNull
    public String resource() {
        return resourceId == null ? resourceType : resourceType + ":" + resourceId;
    }
}
