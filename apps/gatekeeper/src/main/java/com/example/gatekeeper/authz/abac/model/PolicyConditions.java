package com.example.gatekeeper.authz.abac.model;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Context requirements of a policy. Every present condition must hold for the policy to match.
 *
 * @param ipRange     CIDR block (or single address) that must contain the request's {@code client_ip}
 * @param timeWindow  window that must contain the evaluation time
 * @param mfaRequired when true, the context must carry {@code mfa_verified = true}
 * @param attributes  context entries that must be present with equal values
 */
public record PolicyConditions(
        @Nullable String ipRange,
        @Nullable TimeWindow timeWindow,
        @Nullable Boolean mfaRequired,
        @Nullable Map<String, Object> attributes
) {
    public static final PolicyConditions NONE = new PolicyConditions(null, null, null, null);

    public boolean isEmpty() {
        return ipRange == null
                && timeWindow == null
                && !Boolean.TRUE.equals(mfaRequired)
                && (attributes == null || attributes.isEmpty());
    }
}
