package com.example.gatekeeper.authz.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Set;

/**
 * A user's membership in one organization. Only {@link MembershipStatus#ACTIVE} memberships
 * are ever authorized.
 */
@Document(collection = "memberships")
@CompoundIndex(name = "user_org_idx", def = "{'userId': 1, 'organizationId': 1}", unique = true)
public record Membership(
        @Id String id,
        String userId,
        String organizationId,
        String roleId,
        Set<String> customPermissions,
        MembershipStatus status
) {
    public Membership {
        customPermissions = customPermissions == null ? Set.of() : Set.copyOf(customPermissions);
    }

    public boolean isActive() {
        return status == MembershipStatus.ACTIVE;
    }

    public Membership withRole(String roleId) {
        return new Membership(id, userId, organizationId, roleId, customPermissions, status);
    }

    public Membership withStatus(MembershipStatus status) {
        return new Membership(id, userId, organizationId, roleId, customPermissions, status);
    }
}
