package com.example.gatekeeper.authz.abac.model;

public enum PolicyEffect {
    ALLOW,
    DENY
}
