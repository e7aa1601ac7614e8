package com.example.gatekeeper.authz.abac.model;

/**
 * What a policy is attached to. Organization policies apply to every subject of the tenant.
 */
public enum PolicyTargetType {
    USER,
    ROLE,
    ORGANIZATION
}
