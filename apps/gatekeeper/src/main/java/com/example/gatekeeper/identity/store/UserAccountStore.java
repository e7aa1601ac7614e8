package com.example.gatekeeper.identity.store;

import com.example.gatekeeper.identity.model.UserAccount;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

public interface UserAccountStore {

    @NonNull
    Mono<UserAccount> findById(@NonNull String userId);

    @NonNull
    Mono<UserAccount> save(@NonNull UserAccount account);
}
