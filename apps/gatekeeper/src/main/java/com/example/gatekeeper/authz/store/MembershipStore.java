package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.model.Membership;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface MembershipStore {

    @NonNull
    Mono<Membership> findByUserAndOrganization(@NonNull String userId, @NonNull String organizationId);

    @NonNull
    Flux<Membership> findByRole(@NonNull String roleId);

    @NonNull
    Mono<Membership> save(@NonNull Membership membership);
}
