package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.model.Role;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface RoleStore {

    @NonNull
    Mono<Role> findById(@NonNull String roleId);

    @NonNull
    Flux<Role> findByOrganization(@NonNull String organizationId);

    /**
     * Direct children of a role.
     */
    @NonNull
    Flux<Role> findByParent(@NonNull String parentRoleId);

    @NonNull
    Mono<Role> save(@NonNull Role role);

    @NonNull
    Mono<Boolean> deleteById(@NonNull String roleId);
}
