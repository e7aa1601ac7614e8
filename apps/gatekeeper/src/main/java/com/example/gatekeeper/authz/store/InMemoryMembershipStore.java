package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.model.Membership;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryMembershipStore implements MembershipStore {

    // keyed by userId + '\n' + organizationId
    private final ConcurrentHashMap<String, Membership> memberships = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public Mono<Membership> findByUserAndOrganization(@NonNull String userId, @NonNull String organizationId) {
        return Mono.justOrEmpty(memberships.get(key(userId, organizationId)));
    }

    @Override
    @NonNull
    public Flux<Membership> findByRole(@NonNull String roleId) {
        return Flux.defer(() -> Flux.fromStream(memberships.values().stream()
                .filter(membership -> roleId.equals(membership.roleId()))));
    }

    @Override
    @NonNull
    public Mono<Membership> save(@NonNull Membership membership) {
        return Mono.fromCallable(() -> {
            memberships.put(key(membership.userId(), membership.organizationId()), membership);
            return membership;
        });
    }

    private static String key(String userId, String organizationId) {
        return userId + '\n' + organizationId;
    }
}
