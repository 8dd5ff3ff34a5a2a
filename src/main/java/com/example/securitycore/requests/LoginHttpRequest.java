package com.example.securitycore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record LoginHttpRequest(
        @JsonProperty("tenant_id") @NotBlank String tenantId,
        @JsonProperty("user_id") @NotBlank String userId,
        @JsonProperty("password") @NotBlank String password
) {
    @Override
    public String toString() {
        return "LoginHttpRequest[tenantId=" + tenantId + ", userId=" + userId + "]";
    }
}
