package com.example.securitycore.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EncryptedFieldResponse(
        @JsonProperty("ciphertext") String ciphertext,
        @JsonProperty("purpose") String purpose,
        @JsonProperty("key_version") int keyVersion
) {}
