package com.example.gatekeeper.authz.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.authz.abac.engine.PolicyDecisionCache;
import com.example.gatekeeper.authz.abac.model.AccessPolicy;
import com.example.gatekeeper.authz.abac.model.PolicyConditions;
import com.example.gatekeeper.authz.abac.model.PolicyRule;
import com.example.gatekeeper.authz.abac.model.PolicyTargetType;
import com.example.gatekeeper.authz.abac.model.PolicyValidationException;
import com.example.gatekeeper.authz.abac.model.RulePredicate;
import com.example.gatekeeper.authz.store.PolicyStore;
import com.example.gatekeeper.common.exception.ResourceNotFoundException;
import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.web.util.matcher.IpAddressMatcher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Policy mutations. A write bumps the tenant's policy generation so that no cached evaluation
 * computed before the write is served afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyAdminService {

    private final PolicyStore policyStore;
    private final PolicyDecisionCache policyDecisionCache;
    private final AuditChainService auditChain;

    @NonNull
    public Mono<AccessPolicy> savePolicy(@NonNull AccessPolicy policy, @NonNull String actorId) {
        return Mono.fromRunnable(() -> validate(policy))
                .then(policyStore.save(policy))
                .flatMap(saved -> policyDecisionCache.invalidateTenant(saved.tenantId())
                        .then(audit(saved, actorId, "saved"))
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Policy saved: id={}, tenant={}, effect={}, priority={}",
                        StringSanitizer.forLog(saved.id()), StringSanitizer.forLog(saved.tenantId()),
                        saved.effect(), saved.priority()));
    }

    @NonNull
    public Mono<Void> deletePolicy(@NonNull String policyId, @NonNull String actorId) {
        return policyStore.findById(policyId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Policy not found")))
                .flatMap(policy -> policyStore.deleteById(policyId)
                        .then(policyDecisionCache.invalidateTenant(policy.tenantId()))
                        .then(audit(policy, actorId, "deleted")))
                .doOnSuccess(v -> log.info("Policy deleted: id={}", StringSanitizer.forLog(policyId)));
    }

    /**
     * @throws PolicyValidationException if the policy cannot be evaluated as written
     */
    static void validate(AccessPolicy policy) {
        if (isBlank(policy.id()) || isBlank(policy.tenantId()) || isBlank(policy.name())) {
            throw new PolicyValidationException("Policy id, tenant and name are required");
        }
        if (policy.effect() == null || policy.targetType() == null) {
            throw new PolicyValidationException("Policy effect and target type are required");
        }
        if (policy.targetType() != PolicyTargetType.ORGANIZATION && isBlank(policy.targetId())) {
            throw new PolicyValidationException("User and role policies need a target id");
        }
        if ((policy.resourceType() == null) != (policy.resourcePattern() == null)) {
            throw new PolicyValidationException("Resource type and resource pattern must be set together");
        }
        if (policy.actions().stream().anyMatch(PolicyAdminService::isBlank)) {
            throw new PolicyValidationException("Policy actions must not be blank");
        }
        validateConditions(policy.conditions());
        for (PolicyRule rule : policy.rules()) {
            if (rule.kind() == null || rule.predicates().isEmpty()) {
                throw new PolicyValidationException("Policy rules need a kind and at least one predicate");
            }
            for (RulePredicate predicate : rule.predicates()) {
                if (predicate.field() == null || predicate.pattern() == null) {
                    throw new PolicyValidationException("Rule predicates need a field and a pattern");
                }
            }
        }
    }

    private static void validateConditions(PolicyConditions conditions) {
        if (conditions.ipRange() != null) {
            try {
                new IpAddressMatcher(conditions.ipRange());
            } catch (IllegalArgumentException e) {
                throw new PolicyValidationException("Invalid ip_range condition");
            }
        }
        if (conditions.timeWindow() != null
                && conditions.timeWindow().start() != null
                && conditions.timeWindow().end() != null
                && conditions.timeWindow().end().isBefore(conditions.timeWindow().start())) {
            throw new PolicyValidationException("Time window ends before it starts");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Mono<Void> audit(AccessPolicy policy, String actorId, String operation) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation);
        data.put("policy_id", policy.id());
        data.put("name", policy.name());
        data.put("effect", policy.effect().name());
        data.put("priority", policy.priority());
        data.put("enabled", policy.enabled());
        return auditChain.append(policy.tenantId(), actorId, AuditEventType.POLICY_CHANGED, data, null, null)
                .then()
                .onErrorResume(e -> {
                    log.error("Failed to audit policy change: policy={}, error={}",
                            StringSanitizer.forLog(policy.id()), e.getMessage());
                    return Mono.empty();
                });
    }
}
