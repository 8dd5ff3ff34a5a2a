package com.example.securitycore.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LoginResponse(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("csrf_token") String csrfToken,
        @JsonProperty("expires_at") long expiresAt,
        @JsonProperty("absolute_expiry") long absoluteExpiry
) {}
