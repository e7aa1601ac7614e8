package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.abac.model.AccessPolicy;
import com.example.gatekeeper.authz.abac.model.PolicyTargetType;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

public interface PolicyStore {

    /**
     * Policies of a tenant attached to any of the given targets.
     */
    @NonNull
    Flux<AccessPolicy> findByTargets(@NonNull String tenantId,
                                     @NonNull PolicyTargetType targetType,
                                     @NonNull Collection<String> targetIds);

    /**
     * Organization-wide policies of a tenant.
     */
    @NonNull
    Flux<AccessPolicy> findTenantWide(@NonNull String tenantId);

    /**
     * Policies of a tenant that declare a resource type and pattern.
     */
    @NonNull
    Flux<AccessPolicy> findResourceScoped(@NonNull String tenantId);

    @NonNull
    Mono<AccessPolicy> findById(@NonNull String policyId);

    @NonNull
    Mono<AccessPolicy> save(@NonNull AccessPolicy policy);

    @NonNull
    Mono<Boolean> deleteById(@NonNull String policyId);
}
