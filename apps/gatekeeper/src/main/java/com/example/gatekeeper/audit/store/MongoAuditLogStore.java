package com.example.gatekeeper.audit.store;

import com.example.gatekeeper.audit.model.AuditLogEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * MongoDB audit storage. The unique (chainScope, sequence) index turns a concurrent append
 * from another process into a duplicate-key error, surfaced as {@link AuditChainConflictException}.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoAuditLogStore implements AuditLogStore {

    private static final String SCOPE = "chainScope";
    private static final String SEQUENCE = "sequence";

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    @NonNull
    public Mono<AuditLogEntry> findLatest(@NonNull String chainScope) {
        Query query = Query.query(Criteria.where(SCOPE).is(chainScope))
                .with(Sort.by(Sort.Direction.DESC, SEQUENCE))
                .limit(1);
        return mongoTemplate.findOne(query, AuditLogEntry.class);
    }

    @Override
    @NonNull
    public Mono<AuditLogEntry> insert(@NonNull AuditLogEntry entry) {
        return mongoTemplate.insert(entry)
                .onErrorMap(DuplicateKeyException.class,
                        e -> new AuditChainConflictException(entry.chainScope(), entry.sequence()));
    }

    @Override
    @NonNull
    public Flux<AuditLogEntry> findByScope(@NonNull String chainScope) {
        Query query = Query.query(Criteria.where(SCOPE).is(chainScope))
                .with(Sort.by(Sort.Direction.ASC, SEQUENCE));
        return mongoTemplate.find(query, AuditLogEntry.class);
    }

    @Override
    @NonNull
    public Flux<AuditLogEntry> findByScopeBetween(@NonNull String chainScope,
                                                   @NonNull Instant from,
                                                   @NonNull Instant to) {
        Query query = Query.query(Criteria.where(SCOPE).is(chainScope)
                        .and("timestamp").gte(from).lt(to))
                .with(Sort.by(Sort.Direction.ASC, SEQUENCE));
        return mongoTemplate.find(query, AuditLogEntry.class);
    }
}
