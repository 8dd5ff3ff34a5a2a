package com.example.securitycore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Payload of POST /tenants/{tenantId}/fields/encrypt.
 */
public record EncryptFieldHttpRequest(
        @JsonProperty("purpose") @NotBlank String purpose,
        @JsonProperty("plaintext") @NotNull String plaintext
) {
    @Override
    public String toString() {
        return "EncryptFieldHttpRequest[purpose=" + purpose + "]";
    }
}
