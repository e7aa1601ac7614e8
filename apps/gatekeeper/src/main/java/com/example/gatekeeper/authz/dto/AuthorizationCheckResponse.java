package com.example.gatekeeper.authz.dto;

import com.example.gatekeeper.authz.model.AuthorizationDecision;

import java.util.List;

public record AuthorizationCheckResponse(
        boolean allowed,
        String source,
        List<String> reasons
) {
    public static AuthorizationCheckResponse from(AuthorizationDecision decision) {
        return new AuthorizationCheckResponse(decision.allowed(), decision.source().name(), decision.reasons());
    }
}
