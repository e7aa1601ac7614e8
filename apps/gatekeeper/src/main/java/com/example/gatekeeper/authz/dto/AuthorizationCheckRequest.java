package com.example.gatekeeper.authz.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Access question asked on behalf of the authenticated caller. The organization is always the
 * caller's token tenant.
 */
public record AuthorizationCheckRequest(
        @JsonProperty("resource_type") @NotBlank @Size(max = 100) String resourceType,
        @JsonProperty("action") @NotBlank @Size(max = 100) String action,
        @JsonProperty("resource_id") @Nullable @Size(max = 200) String resourceId,
        @JsonProperty("context") @Nullable Map<String, Object> context
) {
}
