package com.example.gatekeeper.authz.abac.model;

/**
 * Request attribute a rule predicate inspects.
 */
public enum RuleField {
    SUBJECT,
    ACTION,
    RESOURCE
}
