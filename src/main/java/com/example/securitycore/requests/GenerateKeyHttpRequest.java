package com.example.securitycore.requests;

import com.example.securitycore.models.EncryptionKey;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record GenerateKeyHttpRequest(
        @JsonProperty("type") @NotNull EncryptionKey.KeyType type,
        @JsonProperty("purpose") @NotBlank String purpose,
        @JsonProperty("tenant_id") @NotBlank String tenantId
) {}
