package com.example.gatekeeper.session.store;

import com.example.gatekeeper.session.model.UserSession;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * MongoDB session store. Conditional updates are single-document {@code findAndModify} /
 * {@code findAndReplace} calls filtered on the expected state.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoSessionStore implements SessionStore {

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    @NonNull
    public Mono<UserSession> save(@NonNull UserSession session) {
        return mongoTemplate.save(session);
    }

    @Override
    @NonNull
    public Mono<UserSession> findById(@NonNull String sessionId) {
        return mongoTemplate.findById(sessionId, UserSession.class);
    }

    @Override
    @NonNull
    public Mono<UserSession> findByRefreshTokenJti(@NonNull String refreshTokenJti) {
        return mongoTemplate.findOne(Query.query(Criteria.where("refreshTokenJti").is(refreshTokenJti)),
                UserSession.class);
    }

    @Override
    @NonNull
    public Mono<UserSession> findByAccessTokenJti(@NonNull String accessTokenJti) {
        return mongoTemplate.findOne(Query.query(Criteria.where("accessTokenJti").is(accessTokenJti)),
                UserSession.class);
    }

    @Override
    @NonNull
    public Flux<UserSession> findByFamily(@NonNull String familyId) {
        return mongoTemplate.find(Query.query(Criteria.where("refreshTokenFamily").is(familyId)),
                UserSession.class);
    }

    @Override
    @NonNull
    public Flux<UserSession> findActiveByUser(@NonNull String userId) {
        return mongoTemplate.find(Query.query(Criteria.where("userId").is(userId).and("active").is(true)),
                UserSession.class);
    }

    @Override
    @NonNull
    public Flux<UserSession> findActiveExpiredBefore(@NonNull Instant cutoff) {
        return mongoTemplate.find(Query.query(Criteria.where("active").is(true).and("expiresAt").lte(cutoff)),
                UserSession.class);
    }

    @Override
    @NonNull
    public Mono<UserSession> rotate(@NonNull String expectedRefreshJti, @NonNull UserSession rotated) {
        Query query = Query.query(Criteria.where("_id").is(rotated.id())
                .and("refreshTokenJti").is(expectedRefreshJti)
                .and("active").is(true));
        return mongoTemplate.findAndReplace(query, rotated, FindAndReplaceOptions.options().returnNew());
    }

    @Override
    @NonNull
    public Mono<UserSession> deactivate(@NonNull String sessionId, @NonNull String reason, @NonNull Instant at) {
        Query query = Query.query(Criteria.where("_id").is(sessionId).and("active").is(true));
        Update update = new Update()
                .set("active", false)
                .set("revokedAt", at)
                .set("revokedReason", reason);
        return mongoTemplate.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true),
                UserSession.class);
    }
}
