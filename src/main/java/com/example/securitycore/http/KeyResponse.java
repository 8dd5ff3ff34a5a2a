package com.example.securitycore.http;

import com.example.securitycore.models.EncryptionKey;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Key metadata for administrators. Never carries key material.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyResponse(
        @JsonProperty("key_id") String keyId,
        @JsonProperty("type") EncryptionKey.KeyType type,
        @JsonProperty("purpose") String purpose,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("version") Integer version,
        @JsonProperty("status") EncryptionKey.Status status,
        @JsonProperty("created_at") Long createdAt,
        @JsonProperty("not_after") Long notAfter,
        @JsonProperty("activated_at") Long activatedAt,
        @JsonProperty("deprecated_at") Long deprecatedAt,
        @JsonProperty("revoked_at") Long revokedAt,
        @JsonProperty("destroyed_at") Long destroyedAt,
        @JsonProperty("revocation_reason") String revocationReason
) {

    static KeyResponse of(EncryptionKey key) {
        return new KeyResponse(
                key.getKeyId(),
                key.getKeyType(),
                key.getPurpose(),
                key.getTenantId(),
                key.getVersion(),
                key.getStatus(),
                key.getCreatedAt(),
                key.getNotAfter(),
                key.getActivatedAt(),
                key.getDeprecatedAt(),
                key.getRevokedAt(),
                key.getDestroyedAt(),
                key.getRevocationReason()
        );
    }
}
