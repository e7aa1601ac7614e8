package com.example.gatekeeper.authz.abac.engine;

import com.example.gatekeeper.authz.abac.model.AccessPolicy;
import com.example.gatekeeper.authz.abac.model.PolicyEffect;
import com.example.gatekeeper.authz.abac.model.PolicyEvaluation;
import com.example.gatekeeper.authz.abac.model.PolicyTargetType;
import com.example.gatekeeper.authz.rbac.PermissionResolver;
import com.example.gatekeeper.authz.store.MembershipStore;
import com.example.gatekeeper.authz.store.PolicyStore;
import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates tenant policies for a request.
 *
 * <p>Applicable policies are gathered (subject-targeted, role-targeted, tenant-wide, then
 * resource-pattern matches), disabled and expired ones dropped, and the rest walked in
 * descending priority. A matching deny ends the walk with {@code allowed=false}; a matching
 * allow sets {@code allowed=true} and the walk continues so a lower-priority deny still wins.
 * No matching policy means deny.
 */
@Slf4j
@Component
public class PolicyEvaluator {

    private static final Comparator<AccessPolicy> BY_PRIORITY_DESC =
            Comparator.comparingInt(AccessPolicy::priority).reversed();

    private final PolicyStore policyStore;
    private final MembershipStore membershipStore;
    private final PermissionResolver permissionResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final RuleInterpreter ruleInterpreter;
    private final PolicyDecisionCache decisionCache;
    private final Clock clock;

    public PolicyEvaluator(
            @NonNull PolicyStore policyStore,
            @NonNull MembershipStore membershipStore,
            @NonNull PermissionResolver permissionResolver,
            @NonNull ConditionEvaluator conditionEvaluator,
            @NonNull RuleInterpreter ruleInterpreter,
            @NonNull PolicyDecisionCache decisionCache,
            @NonNull Clock clock) {
        this.policyStore = policyStore;
        this.membershipStore = membershipStore;
        this.permissionResolver = permissionResolver;
        this.conditionEvaluator = conditionEvaluator;
        this.ruleInterpreter = ruleInterpreter;
        this.decisionCache = decisionCache;
        this.clock = clock;
    }

    @NonNull
    public Mono<PolicyEvaluation> evaluate(@NonNull String tenantId,
                                           @NonNull String subject,
                                           @NonNull String action,
                                           @NonNull String resource,
                                           @NonNull Map<String, Object> context) {
        if (!decisionCache.isEnabled()) {
            return evaluateUncached(tenantId, subject, action, resource, context);
        }
        return decisionCache.keyFor(tenantId, subject, action, resource, context)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("Policy cache key unavailable, evaluating without cache: {}", e.getMessage());
                    return Mono.just(Optional.<String>empty());
                })
                .flatMap(key -> key.isEmpty()
                        ? evaluateUncached(tenantId, subject, action, resource, context)
                        : decisionCache.get(key.get())
                                .switchIfEmpty(Mono.defer(() -> evaluateUncached(tenantId, subject, action, resource, context)
                                        .flatMap(evaluation -> decisionCache.put(key.get(), evaluation)
                                                .thenReturn(evaluation)))));
    }

    @NonNull
    Mono<PolicyEvaluation> evaluateUncached(String tenantId, String subject, String action,
                                            String resource, Map<String, Object> context) {
        long started = System.nanoTime();
        return gatherPolicies(tenantId, subject, resource)
                .map(policies -> walk(policies, subject, action, resource, context,
                        Duration.ofNanos(System.nanoTime() - started)))
                .doOnNext(evaluation -> log.debug(
                        "Policy evaluation tenant={} subject={} action={} resource={} allowed={} applied={}",
                        StringSanitizer.forLog(tenantId), StringSanitizer.forLog(subject),
                        StringSanitizer.forLog(action), StringSanitizer.forLog(resource),
                        evaluation.allowed(), evaluation.appliedPolicyIds()));
    }

    /**
     * Applicable policies in gather order, de-duplicated by id, sorted by priority (stable).
     */
    @NonNull
    Mono<List<AccessPolicy>> gatherPolicies(String tenantId, String subject, String resource) {
        Flux<AccessPolicy> userPolicies = policyStore.findByTargets(tenantId, PolicyTargetType.USER, List.of(subject));
        Flux<AccessPolicy> rolePolicies = subjectRoleIds(tenantId, subject)
                .flatMapMany(roleIds -> policyStore.findByTargets(tenantId, PolicyTargetType.ROLE, roleIds));
        Flux<AccessPolicy> tenantPolicies = policyStore.findTenantWide(tenantId);
        Flux<AccessPolicy> resourcePolicies = policyStore.findResourceScoped(tenantId)
                .filter(policy -> GlobPattern.matches(policy.resourcePattern(), resource));

        Instant now = Instant.now(clock);
        return Flux.concat(userPolicies, rolePolicies, tenantPolicies, resourcePolicies)
                .filter(policy -> policy.isApplicableAt(now))
                .collect(LinkedHashMap<String, AccessPolicy>::new,
                        (unique, policy) -> unique.putIfAbsent(policy.id(), policy))
                .map(unique -> {
                    List<AccessPolicy> ordered = new ArrayList<>(unique.values());
                    ordered.sort(BY_PRIORITY_DESC);
                    return ordered;
                });
    }

    // Membership role plus its ancestors; role policies are inherited like permissions
    private Mono<List<String>> subjectRoleIds(String tenantId, String subject) {
        return membershipStore.findByUserAndOrganization(subject, tenantId)
                .flatMap(membership -> Mono.justOrEmpty(membership.roleId()))
                .flatMap(permissionResolver::resolveChain)
                .defaultIfEmpty(List.of());
    }

    private PolicyEvaluation walk(List<AccessPolicy> policies, String subject, String action,
                                  String resource, Map<String, Object> context, Duration gatherTime) {
        long started = System.nanoTime();
        boolean allowed = false;
        boolean explicitlyDenied = false;
        List<String> reasons = new ArrayList<>();
        List<String> applied = new ArrayList<>();

        for (AccessPolicy policy : policies) {
            Optional<String> mismatch = mismatch(policy, subject, action, resource, context);
            if (mismatch.isPresent()) {
                reasons.add(policy.name() + ": " + mismatch.get());
                continue;
            }
            applied.add(policy.id());
            if (policy.effect() == PolicyEffect.DENY) {
                reasons.add(policy.name() + ": Policy matched and denied");
                reasons.add("Explicitly denied by policy: " + policy.name());
                allowed = false;
                explicitlyDenied = true;
                break;
            }
            reasons.add(policy.name() + ": Policy matched and allowed");
            allowed = true;
        }

        Duration total = gatherTime.plusNanos(System.nanoTime() - started);
        return new PolicyEvaluation(allowed, explicitlyDenied, reasons, applied, total, false);
    }

    private Optional<String> mismatch(AccessPolicy policy, String subject, String action,
                                      String resource, Map<String, Object> context) {
        if (!policy.actions().isEmpty() && !policy.actions().contains(action)) {
            return Optional.of("Action '" + action + "' not in policy actions");
        }
        if (policy.resourcePattern() != null && !GlobPattern.matches(policy.resourcePattern(), resource)) {
            return Optional.of("Resource '" + resource + "' doesn't match pattern");
        }
        Optional<String> unmet = conditionEvaluator.firstUnmet(policy.conditions(), context);
        if (unmet.isPresent()) {
            return Optional.of("Conditions not met (" + unmet.get() + ")");
        }
        if (!ruleInterpreter.passes(policy.rules(), subject, action, resource)) {
            return Optional.of("Rules evaluation failed");
        }
        return Optional.empty();
    }
}
