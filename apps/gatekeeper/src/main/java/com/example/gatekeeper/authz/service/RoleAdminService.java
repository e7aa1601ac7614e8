package com.example.gatekeeper.authz.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.authz.abac.engine.PolicyDecisionCache;
import com.example.gatekeeper.authz.model.DefaultRoles;
import com.example.gatekeeper.authz.model.Permission;
import com.example.gatekeeper.authz.model.Role;
import com.example.gatekeeper.authz.pubsub.RoleCacheEventPublisher;
import com.example.gatekeeper.authz.rbac.PermissionResolver;
import com.example.gatekeeper.authz.rbac.RoleHierarchyException;
import com.example.gatekeeper.authz.rbac.RoleHierarchyValidator;
import com.example.gatekeeper.authz.store.MembershipStore;
import com.example.gatekeeper.authz.store.RoleStore;
import com.example.gatekeeper.common.exception.ResourceNotFoundException;
import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Role mutations. Every write validates permission strings and the parent chain, then drops the
 * resolved permissions of the role and of every role inheriting from it, locally and on other pods.
 */
@Slf4j
@Service
public class RoleAdminService {

    private final RoleStore roleStore;
    private final MembershipStore membershipStore;
    private final RoleHierarchyValidator hierarchyValidator;
    private final PermissionResolver permissionResolver;
    private final PolicyDecisionCache policyDecisionCache;
    private final AuditChainService auditChain;
    private final Optional<RoleCacheEventPublisher> eventPublisher;

    public RoleAdminService(
            @NonNull RoleStore roleStore,
            @NonNull MembershipStore membershipStore,
            @NonNull RoleHierarchyValidator hierarchyValidator,
            @NonNull PermissionResolver permissionResolver,
            @NonNull PolicyDecisionCache policyDecisionCache,
            @NonNull AuditChainService auditChain,
            @NonNull Optional<RoleCacheEventPublisher> eventPublisher) {
        this.roleStore = roleStore;
        this.membershipStore = membershipStore;
        this.hierarchyValidator = hierarchyValidator;
        this.permissionResolver = permissionResolver;
        this.policyDecisionCache = policyDecisionCache;
        this.auditChain = auditChain;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Creates or replaces a role.
     *
     * @throws com.example.gatekeeper.authz.model.InvalidPermissionException (as an error signal) for malformed permissions
     * @throws RoleHierarchyException (as an error signal) for an invalid parent or a cycle
     */
    @NonNull
    public Mono<Role> saveRole(@NonNull Role role, @NonNull String actorId) {
        return Mono.fromRunnable(() -> role.permissions().forEach(Permission::parse))
                .then(hierarchyValidator.validateParent(role.id(), role.organizationId(), role.parentRoleId()))
                .then(roleStore.save(role))
                .flatMap(saved -> afterChange(saved.id(), saved.organizationId())
                        .then(audit(saved, actorId, "saved"))
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Role saved: id={}, org={}, parent={}",
                        StringSanitizer.forLog(saved.id()), StringSanitizer.forLog(saved.organizationId()),
                        StringSanitizer.forLog(saved.parentRoleId())));
    }

    /**
     * Deletes a custom role that no role inherits from and no membership references.
     */
    @NonNull
    public Mono<Void> deleteRole(@NonNull String roleId, @NonNull String actorId) {
        return roleStore.findById(roleId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Role not found")))
                .flatMap(role -> {
                    if (role.system()) {
                        return Mono.error(new RoleHierarchyException("System roles cannot be deleted"));
                    }
                    return roleStore.findByParent(roleId).hasElements()
                            .zipWith(membershipStore.findByRole(roleId).hasElements())
                            .flatMap(inUse -> {
                                if (inUse.getT1()) {
                                    return Mono.error(new RoleHierarchyException("Role has inheriting roles"));
                                }
                                if (inUse.getT2()) {
                                    return Mono.error(new RoleHierarchyException("Role is assigned to members"));
                                }
                                // Drop cached descendants before the role disappears from their chains
                                return afterChange(roleId, role.organizationId())
                                        .then(roleStore.deleteById(roleId))
                                        .then(audit(role, actorId, "deleted"));
                            });
                })
                .doOnSuccess(v -> log.info("Role deleted: id={}", StringSanitizer.forLog(roleId)));
    }

    /**
     * Creates the default system roles of a new organization.
     */
    @NonNull
    public Flux<Role> seedDefaultRoles(@NonNull String organizationId, @NonNull String actorId) {
        return Flux.fromIterable(DefaultRoles.forOrganization(organizationId))
                .concatMap(role -> saveRole(role, actorId));
    }

    private Mono<Void> afterChange(String roleId, String organizationId) {
        permissionResolver.invalidate(roleId);
        Mono<Void> broadcast = eventPublisher
                .map(publisher -> publisher.publishEviction(roleId))
                .orElse(Mono.empty());
        return broadcast
                .then(policyDecisionCache.invalidateTenant(organizationId))
                .then();
    }

    private Mono<Void> audit(Role role, String actorId, String operation) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation);
        data.put("role_id", role.id());
        data.put("name", role.name());
        data.put("permissions", role.permissions().stream().sorted().toList());
        if (role.parentRoleId() != null) {
            data.put("parent_role_id", role.parentRoleId());
        }
        return auditChain.append(role.organizationId(), actorId, AuditEventType.ROLE_CHANGED, data, null, null)
                .then()
                .onErrorResume(e -> {
                    log.error("Failed to audit role change: role={}, error={}",
                            StringSanitizer.forLog(role.id()), e.getMessage());
                    return Mono.empty();
                });
    }
}
