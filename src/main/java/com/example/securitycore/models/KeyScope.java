package com.example.securitycore.models;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies the set of key versions that share one active key: (type, purpose, tenant).
 * Purposes are normalised to upper case so "pii" and "PII" resolve to the same ring.
 */
public record KeyScope(EncryptionKey.KeyType type, String purpose, String tenantId) {

    public KeyScope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(tenantId, "tenantId");
        if (purpose.isBlank()) {
            throw new IllegalArgumentException("purpose must be non-blank");
        }
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must be non-blank");
        }
        purpose = normalizePurpose(purpose);
    }

    public static KeyScope data(String purpose, String tenantId) {
        return new KeyScope(EncryptionKey.KeyType.DATA, purpose, tenantId);
    }

    public static String normalizePurpose(String purpose) {
        return purpose.trim().toUpperCase(Locale.ROOT);
    }

    /** Storage id of the scope; purpose and tenant are escaped so no two scopes share one. */
    public String id() {
        return CompositeKeys.join(type.name(), purpose, tenantId);
    }
}
