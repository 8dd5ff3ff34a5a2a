package com.example.securitycore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record DecryptFieldHttpRequest(
        @JsonProperty("purpose") @NotBlank String purpose,
        @JsonProperty("ciphertext") @NotBlank String ciphertext
) {}
