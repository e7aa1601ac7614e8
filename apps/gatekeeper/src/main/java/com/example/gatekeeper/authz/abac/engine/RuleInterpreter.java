package com.example.gatekeeper.authz.abac.engine;

import com.example.gatekeeper.authz.abac.model.PolicyRule;
import com.example.gatekeeper.authz.abac.model.RulePredicate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Interprets policy sub-rules. All rules of a policy must pass.
 */
@Component
public class RuleInterpreter {

    public boolean passes(@NonNull List<PolicyRule> rules,
                          @NonNull String subject,
                          @NonNull String action,
                          @NonNull String resource) {
        for (PolicyRule rule : rules) {
            if (!passes(rule, subject, action, resource)) {
                return false;
            }
        }
        return true;
    }

    boolean passes(@NonNull PolicyRule rule, String subject, String action, String resource) {
        return switch (rule.kind()) {
            case REQUIRE -> rule.predicates().stream()
                    .allMatch(predicate -> test(predicate, subject, action, resource));
            case EXCLUDE -> rule.predicates().stream()
                    .noneMatch(predicate -> test(predicate, subject, action, resource));
        };
    }

    private static boolean test(RulePredicate predicate, String subject, String action, String resource) {
        String value = switch (predicate.field()) {
            case SUBJECT -> subject;
            case ACTION -> action;
            case RESOURCE -> resource;
        };
        return GlobPattern.matches(predicate.pattern(), value);
    }
}
