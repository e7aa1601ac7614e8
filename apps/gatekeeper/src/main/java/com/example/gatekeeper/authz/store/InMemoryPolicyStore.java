package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.abac.model.AccessPolicy;
import com.example.gatekeeper.authz.abac.model.PolicyTargetType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPolicyStore implements PolicyStore {

    private final ConcurrentHashMap<String, AccessPolicy> policies = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public Flux<AccessPolicy> findByTargets(@NonNull String tenantId,
                                            @NonNull PolicyTargetType targetType,
                                            @NonNull Collection<String> targetIds) {
        return select(policy -> tenantId.equals(policy.tenantId())
                && policy.targetType() == targetType
                && policy.targetId() != null
                && targetIds.contains(policy.targetId()));
    }

    @Override
    @NonNull
    public Flux<AccessPolicy> findTenantWide(@NonNull String tenantId) {
        return select(policy -> tenantId.equals(policy.tenantId())
                && policy.targetType() == PolicyTargetType.ORGANIZATION);
    }

    @Override
    @NonNull
    public Flux<AccessPolicy> findResourceScoped(@NonNull String tenantId) {
        return select(policy -> tenantId.equals(policy.tenantId()) && policy.isResourceScoped());
    }

    @Override
    @NonNull
    public Mono<AccessPolicy> findById(@NonNull String policyId) {
        return Mono.justOrEmpty(policies.get(policyId));
    }

    @Override
    @NonNull
    public Mono<AccessPolicy> save(@NonNull AccessPolicy policy) {
        return Mono.fromCallable(() -> {
            policies.put(policy.id(), policy);
            return policy;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteById(@NonNull String policyId) {
        return Mono.fromCallable(() -> policies.remove(policyId) != null);
    }

    // Sorted by id so gather order is stable between calls
    private Flux<AccessPolicy> select(Predicate<AccessPolicy> predicate) {
        return Flux.defer(() -> Flux.fromStream(policies.values().stream()
                .filter(predicate)
                .sorted(Comparator.comparing(AccessPolicy::id))));
    }
}
