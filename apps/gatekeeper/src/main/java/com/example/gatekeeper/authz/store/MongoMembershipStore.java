package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.model.Membership;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoMembershipStore implements MembershipStore {

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    @NonNull
    public Mono<Membership> findByUserAndOrganization(@NonNull String userId, @NonNull String organizationId) {
        Query query = Query.query(Criteria.where("userId").is(userId).and("organizationId").is(organizationId));
        return mongoTemplate.findOne(query, Membership.class);
    }

    @Override
    @NonNull
    public Flux<Membership> findByRole(@NonNull String roleId) {
        return mongoTemplate.find(Query.query(Criteria.where("roleId").is(roleId)), Membership.class);
    }

    @Override
    @NonNull
    public Mono<Membership> save(@NonNull Membership membership) {
        return mongoTemplate.save(membership);
    }
}
