package com.example.securitycore.http;

import com.example.securitycore.models.AuditEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEntryResponse(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("sequence") Long sequence,
        @JsonProperty("entry_id") String entryId,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("event_type") AuditEntry.EventType eventType,
        @JsonProperty("severity") AuditEntry.Severity severity,
        @JsonProperty("category") AuditEntry.Category category,
        @JsonProperty("actor_id") String actorId,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("action") String action,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("payload_encrypted") Boolean payloadEncrypted,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("hash") String hash
) {

    static AuditEntryResponse of(AuditEntry e) {
        return new AuditEntryResponse(
                e.getTenantId(),
                e.getSequence(),
                e.getEntryId(),
                e.getTimestamp(),
                e.getEventType(),
                e.getSeverity(),
                e.category(),
                e.getActorId(),
                e.getResourceType(),
                e.getResourceId(),
                e.getAction(),
                e.getIpAddress(),
                e.getRequestId(),
                e.getPayload(),
                e.getPayloadEncrypted(),
                e.getPrevHash(),
                e.getHash()
        );
    }
}
