package com.example.gatekeeper.authz.rbac;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * A user resource is owned by the user it describes.
 */
@Component
public class UserOwnershipResolver implements OwnershipResolver {

    public static final String RESOURCE_TYPE = "user";

    @Override
    @NonNull
    public String resourceType() {
        return RESOURCE_TYPE;
    }

    @Override
    @NonNull
    public Mono<Boolean> isOwner(@NonNull String principalId, @NonNull String resourceId) {
        return Mono.just(principalId.equals(resourceId));
    }
}
