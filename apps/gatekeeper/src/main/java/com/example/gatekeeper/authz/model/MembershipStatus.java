package com.example.gatekeeper.authz.model;

public enum MembershipStatus {
    ACTIVE,
    INVITED,
    SUSPENDED,
    REMOVED
}
