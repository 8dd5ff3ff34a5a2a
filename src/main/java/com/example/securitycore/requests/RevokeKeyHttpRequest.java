package com.example.securitycore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RevokeKeyHttpRequest(
        @JsonProperty("reason") @NotBlank String reason
) {}
