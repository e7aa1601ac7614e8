package com.example.gatekeeper.auth.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Value of the {@code type} claim.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    @NonNull
    public String claimValue() {
        return claimValue;
    }

    @Nullable
    public static TokenType fromClaim(@Nullable String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
