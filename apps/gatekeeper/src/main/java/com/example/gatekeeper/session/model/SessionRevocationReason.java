package com.example.gatekeeper.session.model;

/**
 * Values stored in {@link UserSession#revokedReason()}.
 */
public final class SessionRevocationReason {

    public static final String USER_LOGOUT = "user_logout";
    public static final String FAMILY_REVOKED_SECURITY = "family_revoked_security";
    public static final String SESSION_EXPIRED = "session_expired";
    public static final String ADMIN_REVOKED = "admin_revoked";
    public static final String ACCOUNT_DEACTIVATED = "account_deactivated";

    private SessionRevocationReason() {
        // Constants class
    }
}
