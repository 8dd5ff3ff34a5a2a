package com.example.securitycore.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DecryptedFieldResponse(
        @JsonProperty("plaintext") String plaintext
) {}
