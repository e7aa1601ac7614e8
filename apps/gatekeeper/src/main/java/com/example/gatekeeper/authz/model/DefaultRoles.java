package com.example.gatekeeper.authz.model;

import java.util.List;
import java.util.Set;

/**
 * System roles seeded into every new organization.
 */
public final class DefaultRoles {

    public static final String OWNER = "Owner";
    public static final String ADMIN = "Admin";
    public static final String MEMBER = "Member";
    public static final String VIEWER = "Viewer";

    private DefaultRoles() {}

    /**
     * Builds the system roles for an organization. Ids are {@code <organizationId>:<name>} lowercased.
     */
    public static List<Role> forOrganization(String organizationId) {
        return List.of(
                role(organizationId, OWNER, Set.of("*:*")),
                role(organizationId, ADMIN, Set.of(
                        "organization:*", "user:*", "role:*", "project:*",
                        "settings:*", "webhook:*", "api_key:*", "audit_log:read", "session:admin")),
                role(organizationId, MEMBER, Set.of(
                        "organization:read", "user:read", "user:own:update",
                        "project:read", "project:create", "project:own:*")),
                role(organizationId, VIEWER, Set.of(
                        "organization:read", "user:read", "project:read", "settings:read")));
    }

    private static Role role(String organizationId, String name, Set<String> permissions) {
        return new Role(organizationId + ":" + name.toLowerCase(), organizationId, name, permissions, null, true);
    }
}
