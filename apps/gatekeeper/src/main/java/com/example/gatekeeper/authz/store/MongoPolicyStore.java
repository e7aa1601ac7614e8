package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.abac.model.AccessPolicy;
import com.example.gatekeeper.authz.abac.model.PolicyTargetType;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoPolicyStore implements PolicyStore {

    private static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "_id");

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    @NonNull
    public Flux<AccessPolicy> findByTargets(@NonNull String tenantId,
                                            @NonNull PolicyTargetType targetType,
                                            @NonNull Collection<String> targetIds) {
        if (targetIds.isEmpty()) {
            return Flux.empty();
        }
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)
                        .and("targetType").is(targetType)
                        .and("targetId").in(targetIds))
                .with(BY_ID);
        return mongoTemplate.find(query, AccessPolicy.class);
    }

    @Override
    @NonNull
    public Flux<AccessPolicy> findTenantWide(@NonNull String tenantId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)
                        .and("targetType").is(PolicyTargetType.ORGANIZATION))
                .with(BY_ID);
        return mongoTemplate.find(query, AccessPolicy.class);
    }

    @Override
    @NonNull
    public Flux<AccessPolicy> findResourceScoped(@NonNull String tenantId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)
                        .and("resourceType").ne(null)
                        .and("resourcePattern").ne(null))
                .with(BY_ID);
        return mongoTemplate.find(query, AccessPolicy.class);
    }

    @Override
    @NonNull
    public Mono<AccessPolicy> findById(@NonNull String policyId) {
        return mongoTemplate.findById(policyId, AccessPolicy.class);
    }

    @Override
    @NonNull
    public Mono<AccessPolicy> save(@NonNull AccessPolicy policy) {
        return mongoTemplate.save(policy);
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteById(@NonNull String policyId) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(policyId)), AccessPolicy.class)
                .map(result -> result.getDeletedCount() > 0);
    }
}
