package com.example.gatekeeper.authz.pubsub;

import com.example.gatekeeper.config.properties.AuthzProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Publishes role cache eviction events to Redis pub/sub.
 * Only active in Redis mode to propagate cache invalidations across pods.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
public class RoleCacheEventPublisher {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;
    private final String instanceId;

    public RoleCacheEventPublisher(
            ReactiveStringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            AuthzProperties properties,
            @Value("${app.instance.id:#{T(java.util.UUID).randomUUID().toString()}}") String instanceId) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channel = properties.roleCache().channel();
        this.instanceId = instanceId;
        log.info("Role cache event publisher initialized (instance={}, channel={})", instanceId, channel);
    }

    @NonNull
    public Mono<Void> publishEviction(@NonNull String roleId) {
        return publish(RoleCacheEventMessage.evict(roleId, instanceId));
    }

    @NonNull
    public Mono<Void> publishEvictAll() {
        return publish(RoleCacheEventMessage.evictAll(instanceId));
    }

    private Mono<Void> publish(RoleCacheEventMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            return redisTemplate.convertAndSend(channel, json)
                    .doOnSuccess(count -> log.debug("Published role cache event to {} subscribers: {} {}",
                            count, message.eventType(), message.roleId()))
                    .doOnError(e -> log.warn("Failed to publish role cache event: {}", e.getMessage()))
                    .onErrorResume(e -> Mono.empty())
                    .then();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize role cache event: {}", e.getMessage());
            return Mono.empty();
        }
    }

    /**
     * This instance's id, used to skip self-published events.
     */
    public String getInstanceId() {
        return instanceId;
    }

    public String getChannel() {
        return channel;
    }
}
