package com.example.securitycore.service;

import com.example.securitycore.access.AuditEntryAccess;
import com.example.securitycore.config.AuditRetentionProperties;
import com.example.securitycore.models.AuditEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that enforces retention policy on audit entries.
 * Each category has its own retention period. Before anything is deleted the tenant chain
 * is verified and RETENTION_PURGE entries recording the deleted hashes are appended, at most
 * {@code purge-record-batch-size} hashes each, so the chain still verifies afterwards.
 * RETENTION_PURGE entries themselves are kept forever.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "audit.retention.enabled", havingValue = "true")
public class AuditLogRetentionJob {

    private static final long MILLIS_PER_DAY = 86400000L;

    private final Clock clock;
    private final AuditRetentionProperties properties;
    private final AuditEntryAccess auditEntryAccess;
    private final AuditLogService auditLogService;

    @Scheduled(cron = "${audit.retention.schedule:0 0 2 * * *}")
    public void enforceRetentionPolicy() {
        long startTime = clock.millis();
        int shortestDays = Arrays.stream(AuditEntry.Category.values())
                .mapToInt(properties::retentionDays)
                .min()
                .orElseThrow();
        log.info("Starting audit log retention job at {} (audit {}d, security {}d, access {}d)",
                Instant.ofEpochMilli(startTime), properties.getAuditRetentionDays(),
                properties.getSecurityRetentionDays(), properties.getAccessRetentionDays());

        Map<String, List<AuditEntry>> expiredByTenant = auditEntryAccess
                .findEntriesOlderThan(startTime - shortestDays * MILLIS_PER_DAY)
                .stream()
                .filter(e -> e.getEventType() != AuditEntry.EventType.RETENTION_PURGE)
                .filter(e -> e.getTimestamp() < startTime - properties.retentionDays(e.category()) * MILLIS_PER_DAY)
                .collect(Collectors.groupingBy(AuditEntry::getTenantId, TreeMap::new, Collectors.toCollection(ArrayList::new)));
        log.info("Found {} audit entries to purge across {} tenants",
                expiredByTenant.values().stream().mapToInt(List::size).sum(), expiredByTenant.size());

        int deletedCount = 0;
        int failedCount = 0;
        int skippedTenants = 0;

        for (Map.Entry<String, List<AuditEntry>> tenant : expiredByTenant.entrySet()) {
            String tenantId = tenant.getKey();
            List<AuditEntry> expired = tenant.getValue();
            expired.sort(Comparator.comparing(AuditEntry::getSequence));

            try {
                auditLogService.verifyChain(tenantId);
            } catch (ChainIntegrityException ex) {
                log.error("Aborting audit log retention job: chain of tenant {} does not verify", tenantId);
                throw ex;
            }

            List<List<AuditEntry>> batches = batches(expired, properties.getPurgeRecordBatchSize());
            try {
                for (int i = 0; i < batches.size(); i++) {
                    auditLogService.logRetentionPurge(tenantId, batches.get(i), Map.of(
                            "run_started_at", startTime,
                            "batch", i + 1,
                            "batches", batches.size()));
                }
            } catch (SecurityCoreException ex) {
                // nothing is deleted without a complete purge record
                skippedTenants++;
                log.error("Skipping retention for tenant {}: purge record could not be written", tenantId, ex);
                continue;
            }

            for (AuditEntry entry : expired) {
                try {
                    auditEntryAccess.delete(entry);
                    deletedCount++;
                } catch (RuntimeException ex) {
                    failedCount++;
                    log.warn("Failed to delete audit entry {} of tenant {}: {}",
                            entry.getSequence(), tenantId, ex.getMessage());
                }
            }
        }

        long duration = clock.millis() - startTime;
        log.info("Completed audit log retention job in {}ms: deleted={}, failed={}, skippedTenants={}",
                duration, deletedCount, failedCount, skippedTenants);
    }

    private static List<List<AuditEntry>> batches(List<AuditEntry> entries, int size) {
        List<List<AuditEntry>> result = new ArrayList<>();
        for (int from = 0; from < entries.size(); from += size) {
            result.add(entries.subList(from, Math.min(from + size, entries.size())));
        }
        return result;
    }
}
