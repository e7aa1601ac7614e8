package com.example.gatekeeper.authz.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.model.AuditLogEntry;
import com.example.gatekeeper.authz.model.DefaultRoles;
import com.example.gatekeeper.authz.model.InvalidPermissionException;
import com.example.gatekeeper.authz.model.Role;
import com.example.gatekeeper.authz.rbac.RoleHierarchyException;
import com.example.gatekeeper.common.exception.ResourceNotFoundException;
import com.example.gatekeeper.util.GatekeeperTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RoleAdminServiceTest {

    private static final String ORG = "acme";

    private GatekeeperTestHarness harness;
    private RoleAdminService service;

    @BeforeEach
    void setUp() {
        harness = new GatekeeperTestHarness();
        service = harness.roleAdmin;
        harness.role("viewer", ORG, null, "project:read");
        harness.role("editor", ORG, "viewer", "project:update");
    }

    @Nested
    @DisplayName("saveRole")
    class SaveRole {

        @Test
        @DisplayName("should reject a change that closes a cycle and leave the role unchanged")
        void shouldRejectCycle() {
            Role cyclic = new Role("viewer", ORG, "viewer", Set.of("project:read"), "editor", false);

            StepVerifier.create(service.saveRole(cyclic, "admin-1"))
                    .expectError(RoleHierarchyException.class)
                    .verify();

            assertThat(harness.roleStore.findById("viewer").block().parentRoleId()).isNull();
        }

        @Test
        @DisplayName("should reject malformed permission strings")
        void shouldRejectMalformedPermission() {
            Role role = new Role("broken", ORG, "broken", Set.of("project"), null, false);

            StepVerifier.create(service.saveRole(role, "admin-1"))
                    .expectError(InvalidPermissionException.class)
                    .verify();

            assertThat(harness.roleStore.findById("broken").blockOptional()).isEmpty();
        }

        @Test
        @DisplayName("should make new parent permissions visible to inheriting roles")
        void shouldInvalidateDescendants() {
            assertThat(harness.permissionResolver.resolvePermissions("editor").block())
                    .doesNotContain("report:read");

            service.saveRole(new Role("viewer", ORG, "viewer", Set.of("project:read", "report:read"), null, false),
                    "admin-1").block();

            assertThat(harness.permissionResolver.resolvePermissions("editor").block())
                    .contains("report:read");
        }

        @Test
        @DisplayName("should record the change on the organization's audit chain")
        void shouldAuditChange() {
            service.saveRole(new Role("billing", ORG, "Billing", Set.of("invoice:read"), "viewer", false),
                    "admin-1").block();

            List<AuditLogEntry> entries = harness.auditStore.findByScope(ORG).collectList().block();
            assertThat(entries).hasSize(1);
            AuditLogEntry entry = entries.get(0);
            assertThat(entry.eventType()).isEqualTo(AuditEventType.ROLE_CHANGED.wireName());
            assertThat(entry.userId()).isEqualTo("admin-1");
            assertThat(entry.eventData())
                    .containsEntry("role_id", "billing")
                    .containsEntry("parent_role_id", "viewer");
        }
    }

    @Nested
    @DisplayName("deleteRole")
    class DeleteRole {

        @Test
        @DisplayName("should fail for an unknown role")
        void shouldFailWhenMissing() {
            StepVerifier.create(service.deleteRole("ghost", "admin-1"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse to delete a role others inherit from")
        void shouldRefuseWithChildren() {
            StepVerifier.create(service.deleteRole("viewer", "admin-1"))
                    .expectErrorMessage("Role has inheriting roles")
                    .verify();
        }

        @Test
        @DisplayName("should refuse to delete a role assigned to members")
        void shouldRefuseWhenAssigned() {
            harness.member("u1", ORG, "editor");

            StepVerifier.create(service.deleteRole("editor", "admin-1"))
                    .expectErrorMessage("Role is assigned to members")
                    .verify();
        }

        @Test
        @DisplayName("should refuse to delete system roles")
        void shouldRefuseSystemRole() {
            service.seedDefaultRoles(ORG, "admin-1").blockLast();

            StepVerifier.create(service.deleteRole(ORG + ":viewer", "admin-1"))
                    .expectErrorMessage("System roles cannot be deleted")
                    .verify();
        }

        @Test
        @DisplayName("should delete an unused custom role")
        void shouldDeleteUnusedRole() {
            StepVerifier.create(service.deleteRole("editor", "admin-1"))
                    .verifyComplete();

            assertThat(harness.roleStore.findById("editor").blockOptional()).isEmpty();
        }
    }

    @Test
    @DisplayName("seedDefaultRoles should create the four system roles")
    void shouldSeedDefaultRoles() {
        List<Role> seeded = service.seedDefaultRoles("globex", "system").collectList().block();

        assertThat(seeded).extracting(Role::id)
                .containsExactly("globex:owner", "globex:admin", "globex:member", "globex:viewer");
        assertThat(seeded).allMatch(Role::system);
        assertThat(seeded).extracting(Role::name)
                .containsExactly(DefaultRoles.OWNER, DefaultRoles.ADMIN, DefaultRoles.MEMBER, DefaultRoles.VIEWER);
    }
}
