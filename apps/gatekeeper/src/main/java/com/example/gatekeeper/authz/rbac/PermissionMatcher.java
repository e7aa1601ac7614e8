package com.example.gatekeeper.authz.rbac;

import com.example.gatekeeper.authz.model.Permission;
import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.example.gatekeeper.authz.model.Permission.ADMIN;
import static com.example.gatekeeper.authz.model.Permission.OWN;
import static com.example.gatekeeper.authz.model.Permission.WILDCARD;

/**
 * Matches a requested (resource, action[, resource id]) against a granted permission set.
 *
 * <p>Order of checks, first hit wins:
 * <ol>
 *   <li>{@code resource:action}</li>
 *   <li>{@code *:action}, {@code resource:*}, {@code *:*}</li>
 *   <li>{@code resource:admin}, {@code *:admin}</li>
 *   <li>with a resource id: {@code resource:id:action} (or {@code resource:id:*}), then
 *       {@code resource:own:action} (or {@code resource:own:*}) if the principal owns the resource</li>
 * </ol>
 */
@Slf4j
@Component
public class PermissionMatcher {

    private final Map<String, OwnershipResolver> ownershipResolvers;

    public PermissionMatcher(@NonNull List<OwnershipResolver> ownershipResolvers) {
        this.ownershipResolvers = ownershipResolvers.stream()
                .collect(Collectors.toUnmodifiableMap(OwnershipResolver::resourceType, Function.identity()));
    }

    /**
     * Emits the grant that allowed the request, or completes empty when nothing matches.
     * Ownership lookup failures count as "not owner".
     */
    @NonNull
    public Mono<String> findGrant(@NonNull Set<String> granted,
                                  @NonNull String principalId,
                                  @NonNull String resourceType,
                                  @NonNull String action,
                                  @Nullable String resourceId) {
        Optional<String> typeLevel = findTypeLevelGrant(granted, resourceType, action);
        if (typeLevel.isPresent()) {
            return Mono.just(typeLevel.get());
        }
        if (resourceId == null || resourceId.isBlank()) {
            return Mono.empty();
        }

        Optional<String> instance = firstGranted(granted,
                Permission.of(resourceType, resourceId, action),
                Permission.of(resourceType, resourceId, WILDCARD));
        if (instance.isPresent()) {
            return Mono.just(instance.get());
        }

        Optional<String> ownGrant = firstGranted(granted,
                Permission.of(resourceType, OWN, action),
                Permission.of(resourceType, OWN, WILDCARD));
        if (ownGrant.isEmpty()) {
            return Mono.empty();
        }
        return isOwner(principalId, resourceType, resourceId)
                .filter(Boolean::booleanValue)
                .map(owner -> ownGrant.get());
    }

    /**
     * Steps 1-3 only: grants that apply to every instance of the resource type.
     */
    @NonNull
    public Optional<String> findTypeLevelGrant(@NonNull Set<String> granted,
                                               @NonNull String resourceType,
                                               @NonNull String action) {
        return firstGranted(granted,
                Permission.of(resourceType, action),
                Permission.of(WILDCARD, action),
                Permission.of(resourceType, WILDCARD),
                Permission.of(WILDCARD, WILDCARD),
                Permission.of(resourceType, ADMIN),
                Permission.of(WILDCARD, ADMIN));
    }

    private Mono<Boolean> isOwner(String principalId, String resourceType, String resourceId) {
        OwnershipResolver resolver = ownershipResolvers.get(resourceType);
        if (resolver == null) {
            log.debug("No ownership resolver for resource type {}", StringSanitizer.forLog(resourceType));
            return Mono.just(false);
        }
        return resolver.isOwner(principalId, resourceId)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Ownership check failed for {}/{}: {}", StringSanitizer.forLog(resourceType),
                            StringSanitizer.forLog(resourceId), e.getMessage());
                    return Mono.just(false);
                });
    }

    private static Optional<String> firstGranted(Set<String> granted, String... candidates) {
        for (String candidate : candidates) {
            if (granted.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
