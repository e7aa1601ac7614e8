package com.example.gatekeeper.authz.rbac;

import com.example.gatekeeper.authz.store.RoleStore;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.Set;

/**
 * Keeps the role hierarchy a forest: a role's parent must exist in the same organization and
 * must not have the role itself among its ancestors.
 */
@Component
@RequiredArgsConstructor
public class RoleHierarchyValidator {

    private final RoleStore roleStore;

    /**
     * Completes empty when {@code roleId} may take {@code parentRoleId} as parent,
     * otherwise signals {@link RoleHierarchyException}.
     */
    @NonNull
    public Mono<Void> validateParent(@NonNull String roleId,
                                     @NonNull String organizationId,
                                     @Nullable String parentRoleId) {
        if (parentRoleId == null) {
            return Mono.empty();
        }
        if (parentRoleId.equals(roleId)) {
            return Mono.error(new RoleHierarchyException("A role cannot inherit from itself"));
        }
        return roleStore.findById(parentRoleId)
                .switchIfEmpty(Mono.error(new RoleHierarchyException("Parent role does not exist")))
                .flatMap(parent -> {
                    if (!organizationId.equals(parent.organizationId())) {
                        return Mono.error(new RoleHierarchyException(
                                "Parent role belongs to another organization"));
                    }
                    Set<String> visited = new HashSet<>();
                    visited.add(roleId);
                    return ascend(parentRoleId, visited);
                });
    }

    private Mono<Void> ascend(String currentId, Set<String> visited) {
        if (!visited.add(currentId)) {
            return Mono.error(new RoleHierarchyException("Role inheritance would create a cycle"));
        }
        return roleStore.findById(currentId)
                .flatMap(role -> role.parentRoleId() == null
                        ? Mono.<Void>empty()
                        : ascend(role.parentRoleId(), visited));
    }
}
