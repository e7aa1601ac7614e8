package com.example.gatekeeper.identity.store;

import com.example.gatekeeper.identity.model.UserAccount;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoUserAccountStore implements UserAccountStore {

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    @NonNull
    public Mono<UserAccount> findById(@NonNull String userId) {
        return mongoTemplate.findById(userId, UserAccount.class);
    }

    @Override
    @NonNull
    public Mono<UserAccount> save(@NonNull UserAccount account) {
        return mongoTemplate.save(account);
    }
}
