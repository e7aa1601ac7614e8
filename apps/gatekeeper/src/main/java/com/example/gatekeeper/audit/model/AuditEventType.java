package com.example.gatekeeper.audit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Security-relevant events recorded in the audit chain. The wire name is what gets hashed.
 */
public enum AuditEventType {
    SESSION_CREATED("session_created"),
    SESSION_REFRESHED("session_refreshed"),
    SESSION_REVOKED("session_revoked"),
    SESSION_EXPIRED("session_expired"),
    TOKEN_REPLAY_DETECTED("token_replay_detected"),
    AUTHORIZATION_CHECKED("authorization_checked"),
    ROLE_CHANGED("role_changed"),
    POLICY_CHANGED("policy_changed"),
    MEMBERSHIP_CHANGED("membership_changed"),
    SIGNING_KEY_ROTATED("signing_key_rotated");

    private final String wireName;

    AuditEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
