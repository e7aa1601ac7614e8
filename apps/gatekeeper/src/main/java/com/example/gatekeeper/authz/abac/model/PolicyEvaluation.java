package com.example.gatekeeper.authz.abac.model;

import java.time.Duration;
import java.util.List;

/**
 * Result of evaluating all applicable policies for one request.
 *
 * @param allowed           final policy verdict (default deny)
 * @param explicitlyDenied  a matching deny policy stopped evaluation
 * @param reasons           {@code "<policy name>: <reason>"} per evaluated policy, in order
 * @param appliedPolicyIds  ids of matching policies, in order
 * @param duration          evaluation time (of the first evaluation when served from cache)
 * @param cached            served from the decision cache
 */
public record PolicyEvaluation(
        boolean allowed,
        boolean explicitlyDenied,
        List<String> reasons,
        List<String> appliedPolicyIds,
        Duration duration,
        boolean cached
) {
    public PolicyEvaluation {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        appliedPolicyIds = appliedPolicyIds == null ? List.of() : List.copyOf(appliedPolicyIds);
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static PolicyEvaluation noPolicies(Duration duration) {
        return new PolicyEvaluation(false, false, List.of(), List.of(), duration, false);
    }

    public PolicyEvaluation asCached() {
        return new PolicyEvaluation(allowed, explicitlyDenied, reasons, appliedPolicyIds, duration, true);
    }
}
