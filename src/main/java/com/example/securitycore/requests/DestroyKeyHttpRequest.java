package com.example.securitycore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * The confirmation must read {@code DESTROY:<keyId>:<version>}.
 */
public record DestroyKeyHttpRequest(
        @JsonProperty("confirmation") @NotBlank String confirmation
) {}
