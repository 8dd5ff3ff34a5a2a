package com.example.securitycore.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Duration;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * One version of a key within a (type, purpose, tenant) scope. Instances are treated as
 * values: a lifecycle transition produces a copy via {@code toBuilder()} and the copy
 * replaces the version in its {@code KeyRing}.
 *
 * <p>The key material is held only in wrapped form and is never serialised to JSON.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class EncryptionKey {

    @NonNull private String scopeId;     // PK "{type}#{purpose}#{tenant}"
    @NonNull private Integer version;    // SK, 1-based and monotonic per scope
    @NonNull private String keyId;
    @NonNull private KeyType keyType;
    @NonNull private String purpose;
    @NonNull private String tenantId;
    @NonNull private Status status;
    @NonNull private Long createdAt;
    @NonNull private Long notAfter;

    private String wrappedMaterial;
    private Long activatedAt;
    private Long deprecatedAt;
    private Long revokedAt;
    private Long destroyedAt;
    private String revocationReason;
    private String destroyedBy;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("scope_id")
    public String getScopeId() { return scopeId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("version")
    public Integer getVersion() { return version; }

    @DynamoDbAttribute("key_id")
    public String getKeyId() { return keyId; }

    @DynamoDbAttribute("key_type")
    public KeyType getKeyType() { return keyType; }

    @DynamoDbAttribute("purpose")
    public String getPurpose() { return purpose; }

    @DynamoDbAttribute("tenant_id")
    public String getTenantId() { return tenantId; }

    @DynamoDbAttribute("status")
    public Status getStatus() { return status; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("not_after")
    public Long getNotAfter() { return notAfter; }

    @JsonIgnore
    @DynamoDbAttribute("wrapped_material")
    public String getWrappedMaterial() { return wrappedMaterial; }

    @DynamoDbAttribute("activated_at")
    public Long getActivatedAt() { return activatedAt; }

    @DynamoDbAttribute("deprecated_at")
    public Long getDeprecatedAt() { return deprecatedAt; }

    @DynamoDbAttribute("revoked_at")
    public Long getRevokedAt() { return revokedAt; }

    @DynamoDbAttribute("destroyed_at")
    public Long getDestroyedAt() { return destroyedAt; }

    @DynamoDbAttribute("revocation_reason")
    public String getRevocationReason() { return revocationReason; }

    @DynamoDbAttribute("destroyed_by")
    public String getDestroyedBy() { return destroyedBy; }

    public KeyScope scope() {
        return new KeyScope(keyType, purpose, tenantId);
    }

    public enum KeyType {
        MASTER(Duration.ofDays(90)),
        DATA(Duration.ofDays(180)),
        SESSION(Duration.ofHours(24)),
        API(Duration.ofDays(365));

        private final Duration defaultRotationPeriod;

        KeyType(Duration defaultRotationPeriod) {
            this.defaultRotationPeriod = defaultRotationPeriod;
        }

        public Duration getDefaultRotationPeriod() {
            return defaultRotationPeriod;
        }
    }

    /**
     * Lifecycle states. Transitions only move one step forward:
     * GENERATED, ACTIVE, DEPRECATED, REVOKED, DESTROYED.
     */
    public enum Status {
        GENERATED,
        ACTIVE,
        DEPRECATED,
        REVOKED,
        DESTROYED;

        public boolean canTransitionTo(Status next) {
            return next != null && next.ordinal() == ordinal() + 1;
        }

        public boolean usableForDecryption() {
            return this == ACTIVE || this == DEPRECATED;
        }
    }
}
