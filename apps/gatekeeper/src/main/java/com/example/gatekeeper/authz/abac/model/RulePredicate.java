package com.example.gatekeeper.authz.abac.model;

/**
 * Glob pattern applied to one request attribute.
 */
public record RulePredicate(RuleField field, String pattern) {

    public static RulePredicate subject(String pattern) {
        return new RulePredicate(RuleField.SUBJECT, pattern);
    }

    public static RulePredicate action(String pattern) {
        return new RulePredicate(RuleField.ACTION, pattern);
    }

    public static RulePredicate resource(String pattern) {
        return new RulePredicate(RuleField.RESOURCE, pattern);
    }
}
