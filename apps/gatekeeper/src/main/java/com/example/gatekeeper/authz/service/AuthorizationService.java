package com.example.gatekeeper.authz.service;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.auth.context.PrincipalContextHolder;
import com.example.gatekeeper.authz.abac.engine.PolicyEvaluator;
import com.example.gatekeeper.authz.abac.model.PolicyEvaluation;
import com.example.gatekeeper.authz.audit.AuthzAuditEvent;
import com.example.gatekeeper.authz.audit.AuthzAuditService;
import com.example.gatekeeper.authz.model.AuthorizationDecision;
import com.example.gatekeeper.authz.model.AuthorizationDecision.Source;
import com.example.gatekeeper.authz.model.AuthorizationRequest;
import com.example.gatekeeper.authz.model.InvalidPermissionException;
import com.example.gatekeeper.authz.model.Membership;
import com.example.gatekeeper.authz.model.Permission;
import com.example.gatekeeper.authz.rbac.PermissionMatcher;
import com.example.gatekeeper.authz.rbac.PermissionResolver;
import com.example.gatekeeper.authz.store.MembershipStore;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.AuthzProperties;
import com.example.gatekeeper.observability.metrics.GatekeeperMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The authorization decision surface. Combines role-based grants with policy evaluation:
 * a matching deny policy always wins, otherwise either a permission grant or an allow policy
 * is sufficient.
 *
 * <p>Never fails: a missing organization, a missing or inactive membership, a timeout or any
 * store error yields a deny with an opaque reason. Every decision is audited.
 */
@Slf4j
@Service
public class AuthorizationService {

    static final String REASON_NO_ORGANIZATION = "No organization context";
    static final String REASON_NO_MEMBERSHIP = "No active membership in organization";
    static final String REASON_UNAVAILABLE = "Authorization could not be evaluated";
    static final String REASON_DEFAULT_DENY = "No permission or policy grants access";

    private final MembershipStore membershipStore;
    private final PermissionResolver permissionResolver;
    private final PermissionMatcher permissionMatcher;
    private final PolicyEvaluator policyEvaluator;
    private final AuthzAuditService auditService;
    private final GatekeeperMetrics metrics;
    private final AuthzProperties properties;
    private final Clock clock;

    public AuthorizationService(
            @NonNull MembershipStore membershipStore,
            @NonNull PermissionResolver permissionResolver,
            @NonNull PermissionMatcher permissionMatcher,
            @NonNull PolicyEvaluator policyEvaluator,
            @NonNull AuthzAuditService auditService,
            @NonNull GatekeeperMetrics metrics,
            @NonNull AuthzProperties properties,
            @NonNull Clock clock) {
        this.membershipStore = membershipStore;
        this.permissionResolver = permissionResolver;
        this.permissionMatcher = permissionMatcher;
        this.policyEvaluator = policyEvaluator;
        this.auditService = auditService;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @NonNull
    public Mono<Boolean> isAuthorized(@NonNull AuthorizationRequest request) {
        return authorize(request).map(AuthorizationDecision::allowed);
    }

    /**
     * Decides {@code request}. Without an explicit organization, the organization of the
     * authenticated principal in the reactive context is used.
     */
    @NonNull
    public Mono<AuthorizationDecision> authorize(@NonNull AuthorizationRequest request) {
        return resolveOrganization(request.organizationId())
                .flatMap(organizationId -> {
                    AuthorizationRequest scoped = request.withOrganization(organizationId);
                    return decide(scoped)
                            .timeout(properties.storeTimeout())
                            .onErrorResume(e -> {
                                log.warn("Authorization failed closed: user={}, resource={}, action={}, error={}",
                                        StringSanitizer.forLog(request.principalId()),
                                        StringSanitizer.forLog(request.resource()),
                                        StringSanitizer.forLog(request.action()), e.toString());
                                return Mono.just(AuthorizationDecision.failClosed(REASON_UNAVAILABLE));
                            })
                            .flatMap(decision -> publish(scoped, decision));
                })
                .switchIfEmpty(Mono.defer(() ->
                        publish(request, AuthorizationDecision.failClosed(REASON_NO_ORGANIZATION))));
    }

    private Mono<AuthorizationDecision> decide(AuthorizationRequest request) {
        String organizationId = request.organizationId();
        return activeMembership(request.principalId(), organizationId)
                .flatMap(membership -> effectivePermissions(membership)
                        .flatMap(granted -> {
                            Mono<Optional<String>> grant = permissionMatcher.findGrant(granted,
                                            request.principalId(), request.resourceType(),
                                            request.action(), request.resourceId())
                                    .map(Optional::of)
                                    .defaultIfEmpty(Optional.empty());
                            Mono<PolicyEvaluation> policies = policyEvaluator.evaluate(organizationId,
                                    request.principalId(), request.action(), request.resource(), request.context());
                            return Mono.zip(grant, policies)
                                    .map(tuple -> combine(tuple.getT1(), tuple.getT2()));
                        }))
                .switchIfEmpty(Mono.fromSupplier(() -> AuthorizationDecision.failClosed(REASON_NO_MEMBERSHIP)));
    }

    private AuthorizationDecision combine(Optional<String> grant, PolicyEvaluation policies) {
        if (policies.explicitlyDenied()) {
            return AuthorizationDecision.deny(Source.POLICY_DENY, policies.reasons());
        }
        if (grant.isPresent()) {
            List<String> reasons = new ArrayList<>();
            reasons.add("Granted by permission " + grant.get());
            reasons.addAll(policies.reasons());
            return AuthorizationDecision.allow(Source.RBAC, reasons);
        }
        if (policies.allowed()) {
            return AuthorizationDecision.allow(Source.POLICY, policies.reasons());
        }
        List<String> reasons = new ArrayList<>();
        reasons.add(REASON_DEFAULT_DENY);
        reasons.addAll(policies.reasons());
        return AuthorizationDecision.deny(Source.DEFAULT_DENY, reasons);
    }

    /**
     * True if any of {@code permissions} is granted. Permission strings are checked against the
     * principal's effective permission set only; policies are not consulted.
     */
    @NonNull
    public Mono<Boolean> hasAnyPermission(@NonNull String principalId,
                                          @Nullable String organizationId,
                                          @NonNull List<String> permissions) {
        return checkPermissions(principalId, organizationId, permissions, false);
    }

    /**
     * True if every one of {@code permissions} is granted. An empty list is never satisfied.
     */
    @NonNull
    public Mono<Boolean> hasAllPermissions(@NonNull String principalId,
                                           @Nullable String organizationId,
                                           @NonNull List<String> permissions) {
        return checkPermissions(principalId, organizationId, permissions, true);
    }

    private Mono<Boolean> checkPermissions(String principalId, @Nullable String organizationId,
                                           List<String> permissions, boolean requireAll) {
        String mode = requireAll ? "all" : "any";
        return resolveOrganization(organizationId)
                .flatMap(orgId -> activeMembership(principalId, orgId)
                        .flatMap(membership -> effectivePermissions(membership)
                                .flatMap(granted -> Flux.fromIterable(permissions)
                                        .concatMap(requested -> matches(granted, principalId, requested))
                                        .collectList())
                                .map(results -> {
                                    boolean allowed = !results.isEmpty() && (requireAll
                                            ? results.stream().allMatch(Boolean::booleanValue)
                                            : results.stream().anyMatch(Boolean::booleanValue));
                                    return allowed
                                            ? AuthorizationDecision.allow(Source.RBAC, List.of("Permission check (" + mode + ") satisfied"))
                                            : AuthorizationDecision.deny(Source.DEFAULT_DENY, List.of("Permission check (" + mode + ") not satisfied"));
                                }))
                        .switchIfEmpty(Mono.fromSupplier(() -> AuthorizationDecision.failClosed(REASON_NO_MEMBERSHIP)))
                        .timeout(properties.storeTimeout())
                        .onErrorResume(e -> {
                            log.warn("Permission check failed closed: user={}, error={}",
                                    StringSanitizer.forLog(principalId), e.toString());
                            return Mono.just(AuthorizationDecision.failClosed(REASON_UNAVAILABLE));
                        })
                        .flatMap(decision -> publishPermissionCheck(principalId, orgId, mode, permissions, decision)))
                .switchIfEmpty(Mono.defer(() -> publishPermissionCheck(principalId, null, mode, permissions,
                        AuthorizationDecision.failClosed(REASON_NO_ORGANIZATION))))
                .map(AuthorizationDecision::allowed);
    }

    private Mono<Boolean> matches(Set<String> granted, String principalId, String requested) {
        Permission permission;
        try {
            permission = Permission.parse(requested);
        } catch (InvalidPermissionException e) {
            log.debug("Ignoring malformed permission in check: {}", StringSanitizer.forLog(requested));
            return Mono.just(false);
        }
        if (granted.contains(permission.toString())) {
            return Mono.just(true);
        }
        String resourceId = permission.isScoped() && !Permission.OWN.equals(permission.scope())
                ? permission.scope()
                : null;
        return permissionMatcher.findGrant(granted, principalId, permission.resource(), permission.action(), resourceId)
                .hasElement();
    }

    /**
     * Effective permissions of a principal: resolved role permissions plus custom grants. Empty when
     * there is no organization context, no active membership, or the lookup fails.
     */
    @NonNull
    public Mono<Set<String>> getEffectivePermissions(@NonNull String principalId, @Nullable String organizationId) {
        return resolveOrganization(organizationId)
                .flatMap(orgId -> activeMembership(principalId, orgId))
                .flatMap(this::effectivePermissions)
                .timeout(properties.storeTimeout())
                .defaultIfEmpty(Set.of())
                .onErrorResume(e -> {
                    log.warn("Effective permission lookup failed: user={}, error={}",
                            StringSanitizer.forLog(principalId), e.toString());
                    return Mono.just(Set.of());
                });
    }

    private Mono<Set<String>> effectivePermissions(Membership membership) {
        if (membership.roleId() == null) {
            return Mono.just(membership.customPermissions());
        }
        return permissionResolver.resolvePermissions(membership.roleId())
                .map(rolePermissions -> {
                    Set<String> effective = new HashSet<>(rolePermissions);
                    effective.addAll(membership.customPermissions());
                    return Set.copyOf(effective);
                });
    }

    private Mono<Membership> activeMembership(String principalId, String organizationId) {
        return membershipStore.findByUserAndOrganization(principalId, organizationId)
                .filter(Membership::isActive);
    }

    private Mono<String> resolveOrganization(@Nullable String organizationId) {
        if (organizationId != null && !organizationId.isBlank()) {
            return Mono.just(organizationId);
        }
        return PrincipalContextHolder.getPrincipalIfPresent()
                .map(AuthenticatedPrincipal::tenantId)
                .filter(tenantId -> !tenantId.isBlank());
    }

    private Mono<AuthorizationDecision> publish(AuthorizationRequest request, AuthorizationDecision decision) {
        metrics.recordDecision(decision.allowed(), decision.source().name());
        log.debug("Authorization decision: user={}, resource={}, action={}, allowed={}, source={}",
                StringSanitizer.forLog(request.principalId()), StringSanitizer.forLog(request.resource()),
                StringSanitizer.forLog(request.action()), decision.allowed(), decision.source());
        return auditService.record(AuthzAuditEvent.from(request, decision, Instant.now(clock)))
                .thenReturn(decision);
    }

    private Mono<AuthorizationDecision> publishPermissionCheck(String principalId, @Nullable String organizationId,
                                                              String mode, List<String> permissions,
                                                              AuthorizationDecision decision) {
        metrics.recordDecision(decision.allowed(), decision.source().name());
        return auditService.record(AuthzAuditEvent.permissionCheck(principalId, organizationId, mode, permissions,
                        decision, Instant.now(clock)))
                .thenReturn(decision);
    }
}
