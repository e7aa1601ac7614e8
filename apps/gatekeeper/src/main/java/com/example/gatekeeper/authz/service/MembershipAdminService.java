package com.example.gatekeeper.authz.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.authz.abac.engine.PolicyDecisionCache;
import com.example.gatekeeper.authz.model.Membership;
import com.example.gatekeeper.authz.model.MembershipStatus;
import com.example.gatekeeper.authz.model.Permission;
import com.example.gatekeeper.authz.rbac.RoleHierarchyException;
import com.example.gatekeeper.authz.store.MembershipStore;
import com.example.gatekeeper.authz.store.RoleStore;
import com.example.gatekeeper.common.exception.ResourceNotFoundException;
import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Membership writes: role assignment and status changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipAdminService {

    private final MembershipStore membershipStore;
    private final RoleStore roleStore;
    private final PolicyDecisionCache policyDecisionCache;
    private final AuditChainService auditChain;

    /**
     * Creates or replaces a membership after checking its role belongs to the same organization.
     */
    @NonNull
    public Mono<Membership> saveMembership(@NonNull Membership membership, @NonNull String actorId) {
        return Mono.fromRunnable(() -> membership.customPermissions().forEach(Permission::parse))
                .then(requireRoleInOrganization(membership.roleId(), membership.organizationId()))
                .then(membershipStore.save(membership))
                .flatMap(saved -> changed(saved, actorId, "saved"));
    }

    @NonNull
    public Mono<Membership> assignRole(@NonNull String userId, @NonNull String organizationId,
                                       @NonNull String roleId, @NonNull String actorId) {
        return membershipStore.findByUserAndOrganization(userId, organizationId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Membership not found")))
                .flatMap(membership -> requireRoleInOrganization(roleId, organizationId)
                        .then(membershipStore.save(membership.withRole(roleId))))
                .flatMap(saved -> changed(saved, actorId, "role_assigned"));
    }

    @NonNull
    public Mono<Membership> changeStatus(@NonNull String userId, @NonNull String organizationId,
                                         @NonNull MembershipStatus status, @NonNull String actorId) {
        return membershipStore.findByUserAndOrganization(userId, organizationId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Membership not found")))
                .flatMap(membership -> membershipStore.save(membership.withStatus(status)))
                .flatMap(saved -> changed(saved, actorId, "status_changed"));
    }

    private Mono<Void> requireRoleInOrganization(@Nullable String roleId, String organizationId) {
        if (roleId == null) {
            return Mono.empty();
        }
        return roleStore.findById(roleId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Role not found")))
                .flatMap(role -> organizationId.equals(role.organizationId())
                        ? Mono.<Void>empty()
                        : Mono.error(new RoleHierarchyException("Role belongs to another organization")));
    }

    private Mono<Membership> changed(Membership membership, String actorId, String operation) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation);
        data.put("user_id", membership.userId());
        data.put("status", membership.status().name());
        if (membership.roleId() != null) {
            data.put("role_id", membership.roleId());
        }
        log.info("Membership {}: user={}, org={}", operation, StringSanitizer.forLog(membership.userId()),
                StringSanitizer.forLog(membership.organizationId()));
        return policyDecisionCache.invalidateTenant(membership.organizationId())
                .then(auditChain.append(membership.organizationId(), actorId, AuditEventType.MEMBERSHIP_CHANGED,
                                data, null, null)
                        .then()
                        .onErrorResume(e -> {
                            log.error("Failed to audit membership change: user={}, error={}",
                                    StringSanitizer.forLog(membership.userId()), e.getMessage());
                            return Mono.empty();
                        }))
                .thenReturn(membership);
    }
}
