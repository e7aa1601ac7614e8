package com.example.gatekeeper.authz.rbac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

class PermissionMatcherTest {

    private final PermissionMatcher matcher = new PermissionMatcher(List.of(new UserOwnershipResolver()));

    @Nested
    @DisplayName("type-level grants")
    class TypeLevel {

        @Test
        @DisplayName("should match exact permission")
        void shouldMatchExact() {
            StepVerifier.create(matcher.findGrant(Set.of("project:read"), "u1", "project", "read", null))
                    .expectNext("project:read")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should match action wildcard")
        void shouldMatchActionWildcard() {
            StepVerifier.create(matcher.findGrant(Set.of("project:*"), "u1", "project", "delete", null))
                    .expectNext("project:*")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should match resource wildcard")
        void shouldMatchResourceWildcard() {
            StepVerifier.create(matcher.findGrant(Set.of("*:read"), "u1", "invoice", "read", null))
                    .expectNext("*:read")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should treat admin as every action on the resource")
        void shouldMatchAdmin() {
            StepVerifier.create(matcher.findGrant(Set.of("project:admin"), "u1", "project", "delete", null))
                    .expectNext("project:admin")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should prefer exact grant over wildcard")
        void shouldPreferExact() {
            StepVerifier.create(matcher.findGrant(Set.of("*:*", "project:read"), "u1", "project", "read", null))
                    .expectNext("project:read")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not match other actions")
        void shouldNotMatchOtherAction() {
            StepVerifier.create(matcher.findGrant(Set.of("project:read"), "u1", "project", "update", null))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("instance grants")
    class Instance {

        @Test
        @DisplayName("should match the named instance only")
        void shouldMatchNamedInstance() {
            Set<String> granted = Set.of("project:p1:update");

            StepVerifier.create(matcher.findGrant(granted, "u1", "project", "update", "p1"))
                    .expectNext("project:p1:update")
                    .verifyComplete();
            StepVerifier.create(matcher.findGrant(granted, "u1", "project", "update", "p2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not match instance grants without a resource id")
        void shouldNotMatchWithoutResourceId() {
            StepVerifier.create(matcher.findGrant(Set.of("project:p1:update"), "u1", "project", "update", null))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("ownership grants")
    class Ownership {

        @Test
        @DisplayName("should grant own scope to the owner")
        void shouldGrantToOwner() {
            StepVerifier.create(matcher.findGrant(Set.of("user:own:update"), "u1", "user", "update", "u1"))
                    .expectNext("user:own:update")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny own scope to anyone else")
        void shouldDenyNonOwner() {
            StepVerifier.create(matcher.findGrant(Set.of("user:own:update"), "u1", "user", "update", "u2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny own scope when no resolver knows the resource type")
        void shouldDenyWithoutResolver() {
            StepVerifier.create(matcher.findGrant(Set.of("document:own:read"), "u1", "document", "read", "d1"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should treat resolver failures as not owner")
        void shouldTreatResolverErrorAsNotOwner() {
            OwnershipResolver failing = new OwnershipResolver() {
                @Override
                public String resourceType() {
                    return "document";
                }

                @Override
                public Mono<Boolean> isOwner(String principalId, String resourceId) {
                    return Mono.error(new IllegalStateException("lookup failed"));
                }
            };
            PermissionMatcher withFailing = new PermissionMatcher(List.of(failing));

            StepVerifier.create(withFailing.findGrant(Set.of("document:own:*"), "u1", "document", "read", "d1"))
                    .verifyComplete();
        }
    }
}
