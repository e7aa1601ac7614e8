package com.example.gatekeeper.authz.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * A named permission set within an organization, optionally inheriting from a parent role.
 * System roles are seeded per organization and cannot be deleted.
 */
@Document(collection = "roles")
public record Role(
        @Id String id,
        @Indexed String organizationId,
        String name,
        Set<String> permissions,
        @Nullable String parentRoleId,
        boolean system
) {
    public Role {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public Role withParent(@Nullable String parentRoleId) {
        return new Role(id, organizationId, name, permissions, parentRoleId, system);
    }

    public Role withPermissions(Set<String> permissions) {
        return new Role(id, organizationId, name, permissions, parentRoleId, system);
    }
}
