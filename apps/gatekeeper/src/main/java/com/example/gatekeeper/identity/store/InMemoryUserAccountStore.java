package com.example.gatekeeper.identity.store;

import com.example.gatekeeper.identity.model.UserAccount;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryUserAccountStore implements UserAccountStore {

    private final ConcurrentHashMap<String, UserAccount> accounts = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public Mono<UserAccount> findById(@NonNull String userId) {
        return Mono.justOrEmpty(accounts.get(userId));
    }

    @Override
    @NonNull
    public Mono<UserAccount> save(@NonNull UserAccount account) {
        return Mono.fromCallable(() -> {
            accounts.put(account.id(), account);
            return account;
        });
    }
}
