package com.example.gatekeeper.authz.abac.engine;

import com.example.gatekeeper.authz.abac.model.PolicyEvaluation;
import com.example.gatekeeper.cache.KeyValueStore;
import com.example.gatekeeper.common.json.CanonicalJson;
import com.example.gatekeeper.common.util.CacheKeyUtils;
import com.example.gatekeeper.config.properties.AuthzProperties;
import com.example.gatekeeper.observability.CacheMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Short-lived cache of policy evaluations in the shared key-value store.
 *
 * <p>Keys embed a per-tenant generation counter; bumping it on any policy mutation makes every
 * earlier entry of that tenant unreachable, and the TTL reclaims them. Cache failures are treated
 * as misses so the evaluator always has a way forward.
 */
@Slf4j
@Component
public class PolicyDecisionCache {

    static final String KEY_PREFIX = "policy:eval:";
    static final String GENERATION_PREFIX = "policy:gen:";
    private static final String CACHE_NAME = "policy-decisions";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final AuthzProperties.DecisionCacheProperties properties;
    private final Duration timeout;
    private final CacheMetricsService metrics;

    public PolicyDecisionCache(
            @NonNull KeyValueStore store,
            @NonNull ObjectMapper objectMapper,
            @NonNull AuthzProperties properties,
            @NonNull CacheMetricsService metrics) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties.decisionCache();
        this.timeout = properties.storeTimeout();
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return properties.enabled();
    }

    /**
     * Cache key for one evaluation under the tenant's current policy generation.
     */
    @NonNull
    public Mono<String> keyFor(@NonNull String tenantId,
                               @NonNull String subject,
                               @NonNull String action,
                               @NonNull String resource,
                               @NonNull Map<String, Object> context) {
        return generation(tenantId).map(generation -> KEY_PREFIX + CacheKeyUtils.sha256Hex(
                tenantId + ":" + generation + ":" + subject + ":" + action + ":" + resource
                        + ":" + CanonicalJson.write(context)));
    }

    @NonNull
    public Mono<PolicyEvaluation> get(@NonNull String key) {
        return store.get(key)
                .timeout(timeout)
                .map(json -> {
                    try {
                        return objectMapper.readValue(json, PolicyEvaluation.class).asCached();
                    } catch (Exception e) {
                        throw new IllegalStateException("Unreadable cached policy evaluation", e);
                    }
                })
                .doOnNext(hit -> metrics.recordHit(CACHE_NAME, "kv"))
                .switchIfEmpty(Mono.fromRunnable(() -> metrics.recordMiss(CACHE_NAME, "kv")))
                .onErrorResume(e -> {
                    log.warn("Policy decision cache read failed, evaluating: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    @NonNull
    public Mono<Void> put(@NonNull String key, @NonNull PolicyEvaluation evaluation) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(evaluation))
                .flatMap(json -> store.set(key, json, properties.ttl()))
                .timeout(timeout)
                .then()
                .onErrorResume(e -> {
                    log.warn("Policy decision cache write failed: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Invalidates every cached evaluation of a tenant.
     */
    @NonNull
    public Mono<Long> invalidateTenant(@NonNull String tenantId) {
        return store.increment(GENERATION_PREFIX + tenantId)
                .timeout(timeout)
                .doOnNext(generation -> log.debug("Policy generation for tenant {} is now {}",
                        tenantId, generation));
    }

    private Mono<Long> generation(String tenantId) {
        return store.get(GENERATION_PREFIX + tenantId)
                .timeout(timeout)
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
    }
}
