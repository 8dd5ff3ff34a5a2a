package com.example.securitycore.requests;

import com.example.securitycore.models.AuditEntry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * An event to append to a tenant's audit chain. The ledger assigns sequence, timestamp,
 * entry id and hashes; everything else comes from the caller.
 */
@Builder
public record AuditEventRequest(
        String tenantId,
        AuditEntry.EventType eventType,
        AuditEntry.Severity severity,
        String actorId,
        String resourceType,
        String resourceId,
        String action,
        String ipAddress,
        String requestId,
        Map<String, Object> payload,
        boolean payloadEncrypted
) {

    public AuditEventRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must be non-blank");
        }
        Objects.requireNonNull(eventType, "eventType");
        severity = severity == null ? eventType.getDefaultSeverity() : severity;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
