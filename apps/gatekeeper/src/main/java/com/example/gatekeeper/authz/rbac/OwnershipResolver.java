package com.example.gatekeeper.authz.rbac;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Decides whether a principal owns a resource instance, for {@code resource:own:action} grants.
 * One implementation per resource type; resource types without a resolver are never owned.
 */
public interface OwnershipResolver {

    @NonNull
    String resourceType();

    @NonNull
    Mono<Boolean> isOwner(@NonNull String principalId, @NonNull String resourceId);
}
