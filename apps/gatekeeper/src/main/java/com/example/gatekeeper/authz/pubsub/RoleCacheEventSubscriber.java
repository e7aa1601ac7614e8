package com.example.gatekeeper.authz.pubsub;

import com.example.gatekeeper.authz.rbac.PermissionResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

/**
 * Applies role cache evictions published by other pods to the local resolver cache.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
public class RoleCacheEventSubscriber {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final PermissionResolver permissionResolver;
    private final RoleCacheEventPublisher publisher;

    private Disposable subscription;

    public RoleCacheEventSubscriber(
            ReactiveStringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            PermissionResolver permissionResolver,
            RoleCacheEventPublisher publisher) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.permissionResolver = permissionResolver;
        this.publisher = publisher;
    }

    @PostConstruct
    public void subscribe() {
        subscription = redisTemplate.listenTo(ChannelTopic.of(publisher.getChannel()))
                .map(ReactiveSubscription.Message::getMessage)
                .subscribe(
                        this::handleMessage,
                        e -> log.error("Error in role cache event subscription: {}", e.getMessage())
                );
        log.info("Subscribed to role cache events on channel: {}", publisher.getChannel());
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Unsubscribed from role cache events");
        }
    }

    void handleMessage(@NonNull String json) {
        RoleCacheEventMessage message;
        try {
            message = objectMapper.readValue(json, RoleCacheEventMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse role cache event message: {}", e.getMessage());
            return;
        }

        // Ignore events from this instance
        if (publisher.getInstanceId().equals(message.sourceInstanceId())) {
            log.trace("Ignoring self-published role cache event: {}", message.roleId());
            return;
        }

        log.debug("Received role cache event from {}: {} ({})",
                message.sourceInstanceId(), message.roleId(), message.eventType());
        switch (message.eventType()) {
            case EVICT -> permissionResolver.invalidate(message.roleId());
            case EVICT_ALL -> permissionResolver.invalidateAll();
        }
    }
}
