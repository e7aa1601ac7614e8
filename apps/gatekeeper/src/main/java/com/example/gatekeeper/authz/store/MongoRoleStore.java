package com.example.gatekeeper.authz.store;

import com.example.gatekeeper.authz.model.Role;
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
public class MongoRoleStore implements RoleStore {

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    @NonNull
    public Mono<Role> findById(@NonNull String roleId) {
        return mongoTemplate.findById(roleId, Role.class);
    }

    @Override
    @NonNull
    public Flux<Role> findByOrganization(@NonNull String organizationId) {
        return mongoTemplate.find(Query.query(Criteria.where("organizationId").is(organizationId)), Role.class);
    }

    @Override
    @NonNull
    public Flux<Role> findByParent(@NonNull String parentRoleId) {
        return mongoTemplate.find(Query.query(Criteria.where("parentRoleId").is(parentRoleId)), Role.class);
    }

    @Override
    @NonNull
    public Mono<Role> save(@NonNull Role role) {
        return mongoTemplate.save(role);
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteById(@NonNull String roleId) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(roleId)), Role.class)
                .map(result -> result.getDeletedCount() > 0);
    }
}
