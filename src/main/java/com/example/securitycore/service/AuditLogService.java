package com.example.securitycore.service;

import com.example.securitycore.access.AuditEntryAccess;
import com.example.securitycore.access.ChainConflictException;
import com.example.securitycore.config.AuditProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.EncryptionKey;
import com.example.securitycore.requests.AuditEventRequest;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Append-only, hash-chained audit ledger. Each tenant has its own chain; an append claims
 * the slot after the current tail with a conditional write and retries from a fresh tail
 * when another writer got there first.
 */
@Service
@Slf4j
public class AuditLogService {

    /** Chain used for events that are not attributable to a tenant. */
    public static final String SYSTEM_TENANT = "system";

    static final String PURGED_HASHES = "purged_hashes";

    // MDC keys filled in by the HTTP filters; used when an event does not name them itself.
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_CLIENT_IP = "clientIp";

    private final AuditEntryAccess auditEntryAccess;
    private final AuditProperties properties;
    private final Clock clock;

    public AuditLogService(AuditEntryAccess auditEntryAccess, AuditProperties properties, Clock clock) {
        this.auditEntryAccess = auditEntryAccess;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Appends an event to its tenant chain.
     *
     * @throws SecurityCoreException with code AUDIT_UNAVAILABLE if the entry could not be stored
     */
    public AuditEntry log(AuditEventRequest event) {
        String requestId = event.requestId() != null ? event.requestId() : MDC.get(MDC_REQUEST_ID);
        String actorId = event.actorId() != null ? event.actorId() : MDC.get(MDC_USER_ID);
        String ipAddress = event.ipAddress() != null ? event.ipAddress() : MDC.get(MDC_CLIENT_IP);
        int maxAttempts = Math.max(1, properties.getMaxAppendAttempts());
        for (int attempt = 1; ; attempt++) {
            AuditEntry entry;
            try {
                Optional<AuditEntry> tail = auditEntryAccess.findLatest(event.tenantId());
                entry = AuditEntry.builder()
                        .tenantId(event.tenantId())
                        .sequence(tail.map(t -> t.getSequence() + 1).orElse(1L))
                        .entryId(UUID.randomUUID().toString())
                        .timestamp(clock.millis())
                        .eventType(event.eventType())
                        .severity(event.severity())
                        .prevHash(tail.map(AuditEntry::getHash).orElse(AuditEntry.GENESIS_HASH))
                        .actorId(actorId)
                        .resourceType(event.resourceType())
                        .resourceId(event.resourceId())
                        .action(event.action())
                        .ipAddress(ipAddress)
                        .requestId(requestId)
                        .payload(event.payload())
                        .payloadEncrypted(event.payloadEncrypted())
                        .build();
                auditEntryAccess.append(entry);
            } catch (ChainConflictException ex) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up on {} append for tenant {} after {} attempts",
                            event.eventType(), event.tenantId(), attempt);
                    throw SecurityCoreException.auditUnavailable(ex);
                }
                log.debug("Chain tail of tenant {} moved, retrying append (attempt {})", event.tenantId(), attempt);
                continue;
            } catch (RuntimeException ex) {
                log.error("Failed to append {} for tenant {}", event.eventType(), event.tenantId(), ex);
                throw SecurityCoreException.auditUnavailable(ex);
            }
            if (entry.getSeverity() == AuditEntry.Severity.CRITICAL) {
                log.warn("Critical audit event {} for tenant {} (sequence {})",
                        entry.getEventType(), entry.getTenantId(), entry.getSequence());
            }
            return entry;
        }
    }

    public AuditEntry logDataAccess(String tenantId, String actorId, String resourceType, String resourceId,
                                    String action, Map<String, Object> details) {
        AuditEntry.EventType type = "export".equalsIgnoreCase(action)
                ? AuditEntry.EventType.DATA_EXPORT
                : AuditEntry.EventType.DATA_READ;
        return log(AuditEventRequest.builder()
                .tenantId(tenantId)
                .eventType(type)
                .actorId(actorId)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .action(action)
                .payload(details)
                .build());
    }

    public AuditEntry logDataModification(String tenantId, String actorId, AuditEntry.EventType type,
                                          String resourceType, String resourceId, Map<String, Object> changes) {
        if (type != AuditEntry.EventType.DATA_CREATE
                && type != AuditEntry.EventType.DATA_UPDATE
                && type != AuditEntry.EventType.DATA_DELETE) {
            throw new IllegalArgumentException("Not a data modification event: " + type);
        }
        return log(AuditEventRequest.builder()
                .tenantId(tenantId)
                .eventType(type)
                .actorId(actorId)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .action(type.name().substring("DATA_".length()).toLowerCase(Locale.ROOT))
                .payload(changes)
                .build());
    }

    /**
     * Records a security event. A null tenant goes to the system chain.
     */
    public AuditEntry logSecurityEvent(String tenantId, AuditEntry.EventType type, AuditEntry.Severity severity,
                                       String actorId, String ipAddress, Map<String, Object> details) {
        return log(AuditEventRequest.builder()
                .tenantId(tenantId == null || tenantId.isBlank() ? SYSTEM_TENANT : tenantId)
                .eventType(type)
                .severity(severity)
                .actorId(actorId)
                .ipAddress(ipAddress)
                .payload(details)
                .build());
    }

    public AuditEntry logAuthenticationAttempt(String tenantId, String userId, boolean success,
                                               String ipAddress, String failureReason) {
        Map<String, Object> details = failureReason == null ? Map.of() : Map.of("reason", failureReason);
        return log(AuditEventRequest.builder()
                .tenantId(tenantId == null || tenantId.isBlank() ? SYSTEM_TENANT : tenantId)
                .eventType(success ? AuditEntry.EventType.LOGIN_SUCCESS : AuditEntry.EventType.LOGIN_FAILURE)
                .actorId(userId)
                .ipAddress(ipAddress)
                .action("login")
                .payload(details)
                .build());
    }

    public AuditEntry logKeyEvent(AuditEntry.EventType type, EncryptionKey key, String actorId,
                                  Map<String, Object> details) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("scope", key.getScopeId());
        payload.put("version", key.getVersion());
        payload.put("status", key.getStatus().name());
        if (details != null) {
            payload.putAll(details);
        }
        return log(AuditEventRequest.builder()
                .tenantId(key.getTenantId())
                .eventType(type)
                .actorId(actorId)
                .resourceType("encryption_key")
                .resourceId(key.getKeyId())
                .action(type.name().substring("KEY_".length()).toLowerCase(Locale.ROOT))
                .payload(payload)
                .build());
    }

    /**
     * Records which entries a retention run is about to delete, with their hashes, so the
     * chain still verifies across the gap afterwards.
     */
    public AuditEntry logRetentionPurge(String tenantId, List<AuditEntry> purged, Map<String, Object> details) {
        Map<String, Object> hashes = new LinkedHashMap<>();
        for (AuditEntry e : purged) {
            hashes.put(String.valueOf(e.getSequence()), e.getHash());
        }
        Map<String, Object> payload = new HashMap<>(details == null ? Map.of() : details);
        payload.put("purged_count", purged.size());
        payload.put(PURGED_HASHES, hashes);
        return log(AuditEventRequest.builder()
                .tenantId(tenantId)
                .eventType(AuditEntry.EventType.RETENTION_PURGE)
                .actorId("system")
                .action("purge")
                .payload(payload)
                .build());
    }

    public List<AuditEntry> findEntries(String tenantId, long fromSequence, long toSequence) {
        return auditEntryAccess.findRange(tenantId, fromSequence, toSequence);
    }

    public List<AuditEntry> findEntriesBetween(String tenantId, long startTimestamp, long endTimestamp) {
        return auditEntryAccess.findByTimeRange(tenantId, startTimestamp, endTimestamp);
    }

    public ChainVerification verifyChain(String tenantId) {
        return verifyChain(tenantId, 1, Long.MAX_VALUE);
    }

    /**
     * Recomputes every hash and link between {@code fromSequence} and {@code toSequence}
     * (inclusive, clamped to the current tail). A missing entry is accepted only if a
     * RETENTION_PURGE entry recorded its hash.
     *
     * @throws ChainIntegrityException at the first entry that does not verify
     */
    public ChainVerification verifyChain(String tenantId, long fromSequence, long toSequence) {
        if (fromSequence < 1 || toSequence < fromSequence) {
            throw new IllegalArgumentException("Invalid sequence range " + fromSequence + ".." + toSequence);
        }
        long tail = auditEntryAccess.findLatest(tenantId).map(AuditEntry::getSequence).orElse(0L);
        long last = Math.min(toSequence, tail);
        if (last < fromSequence) {
            return new ChainVerification(tenantId, fromSequence, last, 0, 0, null);
        }

        PurgeIndex purges = new PurgeIndex(tenantId);
        String prevHash = hashBefore(tenantId, fromSequence, purges);
        long expected = fromSequence;
        int checked = 0;
        int accepted = 0;

        for (AuditEntry e : auditEntryAccess.findRange(tenantId, fromSequence, last)) {
            while (expected < e.getSequence()) {
                prevHash = purges.require(expected);
                accepted++;
                expected++;
            }
            if (!e.hashMatches()) {
                throw integrityFailure(tenantId, e.getSequence(), "entry hash does not match its contents");
            }
            if (!e.getPrevHash().equals(prevHash)) {
                throw integrityFailure(tenantId, e.getSequence(), "previous hash link is broken");
            }
            prevHash = e.getHash();
            checked++;
            expected++;
        }
        while (expected <= last) {
            prevHash = purges.require(expected);
            accepted++;
            expected++;
        }
        return new ChainVerification(tenantId, fromSequence, last, checked, accepted, prevHash);
    }

    private String hashBefore(String tenantId, long sequence, PurgeIndex purges) {
        if (sequence == 1) {
            return AuditEntry.GENESIS_HASH;
        }
        List<AuditEntry> previous = auditEntryAccess.findRange(tenantId, sequence - 1, sequence - 1);
        return previous.isEmpty() ? purges.require(sequence - 1) : previous.get(0).getHash();
    }

    private ChainIntegrityException integrityFailure(String tenantId, long sequence, String reason) {
        ChainIntegrityException failure = new ChainIntegrityException(tenantId, sequence, reason);
        log.error("Audit chain integrity failure for tenant {} at sequence {}: {}", tenantId, sequence, reason);
        try {
            logSecurityEvent(tenantId, AuditEntry.EventType.CHAIN_INTEGRITY_FAILURE, AuditEntry.Severity.CRITICAL,
                    "system", null, Map.of("broken_at", sequence, "reason", reason));
        } catch (SecurityCoreException ex) {
            log.error("Could not record chain integrity failure for tenant {}", tenantId, ex);
            failure.addSuppressed(ex);
        }
        return failure;
    }

    /**
     * Hashes of purged entries, loaded from the tenant's RETENTION_PURGE entries the first
     * time a gap is found.
     */
    private final class PurgeIndex {
        private final String tenantId;
        private Map<Long, String> hashes;

        PurgeIndex(String tenantId) {
            this.tenantId = tenantId;
        }

        String require(long sequence) {
            if (hashes == null) {
                hashes = load();
            }
            String hash = hashes.get(sequence);
            if (hash == null) {
                throw integrityFailure(tenantId, sequence, "entry is missing and no purge record covers it");
            }
            return hash;
        }

        private Map<Long, String> load() {
            Map<Long, String> result = new HashMap<>();
            for (AuditEntry e : auditEntryAccess.findRange(tenantId, 1, Long.MAX_VALUE)) {
                if (e.getEventType() != AuditEntry.EventType.RETENTION_PURGE || !e.hashMatches()) {
                    continue;
                }
                Object recorded = e.getPayload() == null ? null : e.getPayload().get(PURGED_HASHES);
                if (recorded instanceof Map<?, ?> map) {
                    map.forEach((seq, hash) -> result.put(Long.parseLong(String.valueOf(seq)), String.valueOf(hash)));
                }
            }
            return result;
        }
    }
}
