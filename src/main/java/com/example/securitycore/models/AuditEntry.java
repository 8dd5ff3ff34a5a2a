package com.example.securitycore.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditEntry {

    public static final String GENESIS_HASH = "0".repeat(64);

    // Required fields; Lombok @NonNull checks them when the builder runs
    @NonNull private String tenantId;    // PK
    @NonNull private Long sequence;      // SK, position in the tenant chain starting at 1
    @NonNull private String entryId;
    @NonNull private Long timestamp;
    @NonNull private EventType eventType;
    @NonNull private Severity severity;
    @NonNull private String prevHash;

    // computed by the builder
    private String hash;

    // Optional fields
    private String actorId;
    private String resourceType;
    private String resourceId;
    private String action;
    private String ipAddress;
    private String requestId;
    private Map<String, Object> payload;
    private Boolean payloadEncrypted;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("tenant_id")
    public String getTenantId() { return tenantId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("entry_id")
    public String getEntryId() { return entryId; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("event_type")
    public EventType getEventType() { return eventType; }

    @DynamoDbAttribute("severity")
    public Severity getSeverity() { return severity; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbAttribute("actor_id")
    public String getActorId() { return actorId; }

    @DynamoDbAttribute("resource_type")
    public String getResourceType() { return resourceType; }

    @DynamoDbAttribute("resource_id")
    public String getResourceId() { return resourceId; }

    @DynamoDbAttribute("action")
    public String getAction() { return action; }

    @DynamoDbAttribute("ip_address")
    public String getIpAddress() { return ipAddress; }

    @DynamoDbAttribute("request_id")
    public String getRequestId() { return requestId; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("payload")
    public Map<String, Object> getPayload() { return payload; }

    @DynamoDbAttribute("payload_encrypted")
    public Boolean getPayloadEncrypted() { return payloadEncrypted; }

    public Category category() {
        return eventType.getCategory();
    }

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL;

        @JsonCreator
        public static Severity fromString(String v) {
            for (Severity s : values()) {
                if (s.name().equalsIgnoreCase(v)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown AuditEntry.Severity: " + v);
        }
    }

    /**
     * Retention class of an entry. Financial and audit records are kept longest.
     */
    public enum Category {
        AUDIT,
        SECURITY,
        ACCESS
    }

    public enum EventType {
        // access
        DATA_READ(Category.ACCESS, Severity.INFO),
        DATA_EXPORT(Category.ACCESS, Severity.INFO),
        LOGIN_SUCCESS(Category.ACCESS, Severity.INFO),
        LOGOUT(Category.ACCESS, Severity.INFO),
        SESSION_CREATED(Category.ACCESS, Severity.INFO),
        SESSION_EXPIRED(Category.ACCESS, Severity.INFO),
        SESSION_EVICTED(Category.ACCESS, Severity.WARNING),

        // audit / financial
        DATA_CREATE(Category.AUDIT, Severity.INFO),
        DATA_UPDATE(Category.AUDIT, Severity.INFO),
        DATA_DELETE(Category.AUDIT, Severity.INFO),
        KEY_GENERATED(Category.AUDIT, Severity.INFO),
        KEY_ROTATED(Category.AUDIT, Severity.INFO),
        KEY_REVOKED(Category.AUDIT, Severity.WARNING),
        KEY_DESTROYED(Category.AUDIT, Severity.CRITICAL),
        COMPLIANCE_REPORT_GENERATED(Category.AUDIT, Severity.INFO),
        CHAIN_VERIFIED(Category.AUDIT, Severity.INFO),
        RETENTION_PURGE(Category.AUDIT, Severity.INFO),

        // security
        LOGIN_FAILURE(Category.SECURITY, Severity.WARNING),
        UNAUTHORIZED_ACCESS_ATTEMPT(Category.SECURITY, Severity.WARNING),
        RATE_LIMIT_EXCEEDED(Category.SECURITY, Severity.WARNING),
        IP_BLOCKED(Category.SECURITY, Severity.WARNING),
        CSRF_VIOLATION(Category.SECURITY, Severity.WARNING),
        SESSION_ANOMALY(Category.SECURITY, Severity.CRITICAL),
        SESSION_LIMIT_EXCEEDED(Category.SECURITY, Severity.WARNING),
        DECRYPTION_FAILURE(Category.SECURITY, Severity.CRITICAL),
        KEY_ACCESS_DENIED(Category.SECURITY, Severity.WARNING),
        CHAIN_INTEGRITY_FAILURE(Category.SECURITY, Severity.CRITICAL),
        SUSPICIOUS_ACTIVITY(Category.SECURITY, Severity.WARNING);

        private final Category category;
        private final Severity defaultSeverity;

        EventType(Category category, Severity defaultSeverity) {
            this.category = category;
            this.defaultSeverity = defaultSeverity;
        }

        public Category getCategory() {
            return category;
        }

        public Severity getDefaultSeverity() {
            return defaultSeverity;
        }

        @JsonCreator
        public static EventType fromString(String v) {
            for (EventType t : values()) {
                if (t.name().equals(v)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown AuditEntry.EventType: " + v);
        }
    }

    // hash chain helpers

    /**
     * SHA-256 over the previous hash followed by the canonical form of every other field.
     * The payload is rendered as JSON with sorted keys so the digest does not depend on map order.
     */
    public static String computeHash(AuditEntry e) {
        String canon = String.join("|",
                nn(e.prevHash),
                nn(e.tenantId),
                e.sequence == null ? "" : String.valueOf(e.sequence),
                nn(e.entryId),
                e.timestamp == null ? "" : String.valueOf(e.timestamp),
                e.eventType == null ? "" : e.eventType.name(),
                e.severity == null ? "" : e.severity.name(),
                nn(e.actorId),
                nn(e.resourceType),
                nn(e.resourceId),
                nn(e.action),
                nn(e.ipAddress),
                nn(e.requestId),
                JsonStringMapAttributeConverter.toCanonicalJson(
                        e.payload == null ? Collections.emptyMap() : e.payload),
                String.valueOf(Boolean.TRUE.equals(e.payloadEncrypted))
        );
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return bytesToHex(md.digest(canon.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public boolean hashMatches() {
        return hash != null && MessageDigest.isEqual(
                hash.getBytes(StandardCharsets.US_ASCII),
                computeHash(this).getBytes(StandardCharsets.US_ASCII));
    }

    private static String nn(String s) { return s == null ? "" : s; }

    private static String bytesToHex(byte[] bytes) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    public static class AuditEntryBuilder {
        public AuditEntry build() {
            AuditEntry e = new AuditEntry(
                    tenantId, sequence, entryId, timestamp, eventType, severity, prevHash,
                    null, actorId, resourceType, resourceId, action, ipAddress, requestId,
                    payload, payloadEncrypted
            );
            e.hash = computeHash(e);
            return e;
        }
    }
}
