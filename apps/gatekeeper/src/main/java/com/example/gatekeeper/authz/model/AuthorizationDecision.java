package com.example.gatekeeper.authz.model;

import org.springframework.lang.NonNull;

import java.util.List;

/**
 * Outcome of an authorization check. {@code reasons} are opaque, human-readable and never
 * contain infrastructure error detail.
 */
public record AuthorizationDecision(
        boolean allowed,
        @NonNull Source source,
        @NonNull List<String> reasons
) {
    public enum Source {
        /** Granted by role or custom permissions. */
        RBAC,
        /** Granted by a matching allow policy. */
        POLICY,
        /** Explicit deny policy. */
        POLICY_DENY,
        /** Nothing granted access. */
        DEFAULT_DENY,
        /** Context, membership or infrastructure failure. */
        FAIL_CLOSED
    }

    public AuthorizationDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static AuthorizationDecision allow(Source source, List<String> reasons) {
        return new AuthorizationDecision(true, source, reasons);
    }

    public static AuthorizationDecision deny(Source source, List<String> reasons) {
        return new AuthorizationDecision(false, source, reasons);
    }

    public static AuthorizationDecision failClosed(String reason) {
        return new AuthorizationDecision(false, Source.FAIL_CLOSED, List.of(reason));
    }
}
