package com.example.gatekeeper.authz.rbac;

import com.example.gatekeeper.authz.store.RoleStore;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.AuthzProperties;
import com.example.gatekeeper.observability.CacheMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves a role's effective permissions by walking its parent chain (child to parent) and
 * unioning each role's direct permissions.
 *
 * <p>Results are cached per role id without time-based expiry. Entries are dropped explicitly
 * through {@link #invalidate(String)}, which also evicts every cached role whose ancestor chain
 * includes the mutated role. Concurrent fills of the same role may race; the value is
 * deterministic for a given hierarchy so last-writer-wins is harmless. A fill that started before
 * an invalidation is never left in the cache.
 */
@Slf4j
@Component
public class PermissionResolver {

    static final String CACHE_NAME = "role-permissions";
    private static final String CACHE_TYPE = "memory";

    private final RoleStore roleStore;
    private final CacheMetricsService metrics;
    private final Cache<String, ResolvedRole> cache;
    private final AtomicLong generation = new AtomicLong();

    public PermissionResolver(
            @NonNull RoleStore roleStore,
            @NonNull AuthzProperties properties,
            @NonNull CacheMetricsService metrics) {
        this.roleStore = roleStore;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.roleCache().maxSize())
                .build();
    }

    /**
     * Effective permissions of a role. A missing role resolves to the empty set.
     */
    @NonNull
    public Mono<Set<String>> resolvePermissions(@NonNull String roleId) {
        return resolve(roleId).map(ResolvedRole::permissions);
    }

    /**
     * Role ids from {@code roleId} up to its root, child first.
     */
    @NonNull
    public Mono<List<String>> resolveChain(@NonNull String roleId) {
        return resolve(roleId).map(resolved -> List.copyOf(resolved.chain()));
    }

    @NonNull
    Mono<ResolvedRole> resolve(@NonNull String roleId) {
        ResolvedRole cached = cache.getIfPresent(roleId);
        if (cached != null) {
            metrics.recordHit(CACHE_NAME, CACHE_TYPE);
            return Mono.just(cached);
        }
        metrics.recordMiss(CACHE_NAME, CACHE_TYPE);
        return Mono.defer(() -> {
            long startedAt = generation.get();
            return walk(roleId, new LinkedHashSet<>(), new HashSet<>())
                    .doOnNext(resolved -> store(roleId, resolved, startedAt));
        });
    }

    // Invalidation bumps the generation before evicting, so a put racing it is undone here
    private void store(String roleId, ResolvedRole resolved, long startedAt) {
        if (generation.get() != startedAt) {
            return;
        }
        cache.put(roleId, resolved);
        if (generation.get() != startedAt) {
            cache.asMap().remove(roleId, resolved);
        }
    }

    private Mono<ResolvedRole> walk(String roleId, LinkedHashSet<String> chain, Set<String> permissions) {
        if (!chain.add(roleId)) {
            log.error("Role hierarchy cycle detected at role {}; chain={}",
                    StringSanitizer.forLog(roleId), chain);
            return Mono.just(ResolvedRole.of(permissions, chain));
        }
        return roleStore.findById(roleId)
                .flatMap(role -> {
                    permissions.addAll(role.permissions());
                    String parentId = role.parentRoleId();
                    if (parentId == null) {
                        return Mono.just(ResolvedRole.of(permissions, chain));
                    }
                    return walk(parentId, chain, permissions);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Role {} not found while resolving permissions", StringSanitizer.forLog(roleId));
                    return ResolvedRole.of(permissions, chain);
                }));
    }

    /**
     * Drops the cached resolution of {@code roleId} and of every role that inherits from it.
     */
    public void invalidate(@NonNull String roleId) {
        generation.incrementAndGet();
        cache.asMap().entrySet().removeIf(entry ->
                entry.getKey().equals(roleId) || entry.getValue().chain().contains(roleId));
        metrics.recordEviction(CACHE_NAME, CACHE_TYPE);
        log.debug("Invalidated resolved permissions for role {} and descendants", StringSanitizer.forLog(roleId));
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        cache.invalidateAll();
        metrics.recordEviction(CACHE_NAME, CACHE_TYPE);
    }

    record ResolvedRole(Set<String> permissions, Set<String> chain) {

        static ResolvedRole of(Set<String> permissions, LinkedHashSet<String> chain) {
            return new ResolvedRole(Set.copyOf(permissions),
                    Collections.unmodifiableSet(new LinkedHashSet<>(chain)));
        }
    }
}
