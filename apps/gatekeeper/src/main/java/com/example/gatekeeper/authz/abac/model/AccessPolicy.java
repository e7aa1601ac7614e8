package com.example.gatekeeper.authz.abac.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Tenant-scoped allow/deny policy evaluated in priority order (higher first).
 */
@Document(collection = "policies")
@CompoundIndex(name = "tenant_target_idx", def = "{'tenantId': 1, 'targetType': 1, 'targetId': 1}")
public record AccessPolicy(
        @Id String id,
        String tenantId,
        String name,
        PolicyEffect effect,
        int priority,
        boolean enabled,
        PolicyTargetType targetType,
        @Nullable String targetId,
        @Nullable String resourceType,
        @Nullable String resourcePattern,
        Set<String> actions,
        PolicyConditions conditions,
        List<PolicyRule> rules,
        @Nullable Instant expiresAt
) {
    public AccessPolicy {
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        conditions = conditions == null ? PolicyConditions.NONE : conditions;
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Disabled or expired policies are never applied.
     */
    public boolean isApplicableAt(Instant now) {
        return enabled && (expiresAt == null || expiresAt.isAfter(now));
    }

    public boolean isResourceScoped() {
        return resourceType != null && resourcePattern != null;
    }
}
