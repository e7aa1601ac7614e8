package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.model.Role;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRoleStore implements RoleStore {

    private final ConcurrentHashMap<String, Role> roles = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public Mono<Role> findById(@NonNull String roleId) {
        return Mono.justOrEmpty(roles.get(roleId));
    }

    @Override
    @NonNull
    public Flux<Role> findByOrganization(@NonNull String organizationId) {
        return Flux.defer(() -> Flux.fromStream(roles.values().stream()
                .filter(role -> organizationId.equals(role.organizationId()))));
    }

    @Override
    @NonNull
    public Flux<Role> findByParent(@NonNull String parentRoleId) {
        return Flux.defer(() -> Flux.fromStream(roles.values().stream()
                .filter(role -> Objects.equals(parentRoleId, role.parentRoleId()))));
    }

    @Override
    @NonNull
    public Mono<Role> save(@NonNull Role role) {
        return Mono.fromCallable(() -> {
            roles.put(role.id(), role);
            return role;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteById(@NonNull String roleId) {
        return Mono.fromCallable(() -> roles.remove(roleId) != null);
    }
}
