package com.example.securitycore.models;

import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Server-side session. Immutable; renewal produces a copy with new {@code lastSeenAt}
 * and {@code expiresAt}.
 */
@Value
@Builder(toBuilder = true)
public class Session {

    @NonNull String sessionId;
    @NonNull String userId;
    @NonNull String tenantId;
    @NonNull Set<String> roles;
    long createdAt;
    long lastSeenAt;
    long expiresAt;        // sliding idle deadline, never beyond absoluteExpiry
    long absoluteExpiry;
    String ipAddress;
    @NonNull String userAgentFingerprint;

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public String userKey() {
        return userKey(tenantId, userId);
    }

    public static String userKey(String tenantId, String userId) {
        return CompositeKeys.join(tenantId, userId);
    }
}
