package com.example.gatekeeper.authz.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EffectivePermissionsResponse(
        @JsonProperty("organization_id") String organizationId,
        @JsonProperty("permissions") List<String> permissions
) {
}
