package com.example.gatekeeper.authz.rbac;

import com.example.gatekeeper.util.GatekeeperTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class RoleHierarchyValidatorTest {

    private GatekeeperTestHarness harness;
    private RoleHierarchyValidator validator;

    @BeforeEach
    void setUp() {
        harness = new GatekeeperTestHarness();
        validator = new RoleHierarchyValidator(harness.roleStore);
        harness.role("base", "acme", null, "project:read");
        harness.role("middle", "acme", "base", "project:update");
        harness.role("top", "acme", "middle", "project:delete");
        harness.role("other-org", "globex", null, "project:read");
    }

    @Test
    @DisplayName("should accept a root role")
    void shouldAcceptNoParent() {
        StepVerifier.create(validator.validateParent("new", "acme", null))
                .verifyComplete();
    }

    @Test
    @DisplayName("should accept an existing parent in the same organization")
    void shouldAcceptValidParent() {
        StepVerifier.create(validator.validateParent("new", "acme", "top"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should reject a role inheriting from itself")
    void shouldRejectSelfParent() {
        StepVerifier.create(validator.validateParent("base", "acme", "base"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(RoleHierarchyException.class)
                        .hasMessageContaining("itself"))
                .verify();
    }

    @Test
    @DisplayName("should reject a missing parent")
    void shouldRejectMissingParent() {
        StepVerifier.create(validator.validateParent("new", "acme", "ghost"))
                .expectError(RoleHierarchyException.class)
                .verify();
    }

    @Test
    @DisplayName("should reject a parent from another organization")
    void shouldRejectCrossOrganization() {
        StepVerifier.create(validator.validateParent("new", "acme", "other-org"))
                .expectErrorMessage("Parent role belongs to another organization")
                .verify();
    }

    @Test
    @DisplayName("should reject re-parenting that closes a cycle")
    void shouldRejectCycle() {
        StepVerifier.create(validator.validateParent("base", "acme", "top"))
                .expectErrorMessage("Role inheritance would create a cycle")
                .verify();
    }
}
