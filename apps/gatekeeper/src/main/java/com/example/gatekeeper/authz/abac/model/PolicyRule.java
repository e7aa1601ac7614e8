package com.example.gatekeeper.authz.abac.model;

import java.util.List;

/**
 * Sub-rule embedded in a policy.
 *
 * <ul>
 *   <li>{@link Kind#REQUIRE}: passes only when every predicate matches.</li>
 *   <li>{@link Kind#EXCLUDE}: fails as soon as any predicate matches.</li>
 * </ul>
 */
public record PolicyRule(Kind kind, List<RulePredicate> predicates) {

    public enum Kind {
        REQUIRE,
        EXCLUDE
    }

    public PolicyRule {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
    }

    public static PolicyRule require(RulePredicate... predicates) {
        return new PolicyRule(Kind.REQUIRE, List.of(predicates));
    }

    public static PolicyRule exclude(RulePredicate... predicates) {
        return new PolicyRule(Kind.EXCLUDE, List.of(predicates));
    }
}
