package com.example.securitycore.service;

import com.example.securitycore.config.AuditProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.requests.AuditEventRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Summarises a tenant's audit chain over a period: event counts, critical incidents and
 * days with unusual activity. Days are UTC calendar days.
 *
 * <p>The chain is verified first; no report is produced over a chain that does not verify.
 */
@Service
@Slf4j
public class ComplianceReportService {

    private static final Set<AuditEntry.EventType> UNAUTHORIZED = Set.of(
            AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT,
            AuditEntry.EventType.SESSION_ANOMALY);

    private final AuditLogService auditLogService;
    private final AuditProperties properties;
    private final Clock clock;

    public ComplianceReportService(AuditLogService auditLogService, AuditProperties properties, Clock clock) {
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    public ComplianceReport generateComplianceReport(String tenantId, Instant start, Instant end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Report period end must be after its start");
        }
        List<AuditEntry> entries = auditLogService.findEntriesBetween(tenantId, start.toEpochMilli(), end.toEpochMilli());

        try {
            auditLogService.verifyChain(tenantId);
        } catch (ChainIntegrityException ex) {
            log.error("Refusing compliance report for tenant {}: chain does not verify", tenantId);
            throw ex;
        }

        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> byCategory = new TreeMap<>();
        Set<String> actors = new HashSet<>();
        List<ComplianceReport.Incident> incidents = new ArrayList<>();
        for (AuditEntry e : entries) {
            byType.merge(e.getEventType().name(), 1L, Long::sum);
            bySeverity.merge(e.getSeverity().name(), 1L, Long::sum);
            byCategory.merge(e.category().name(), 1L, Long::sum);
            if (e.getActorId() != null) {
                actors.add(e.getActorId());
            }
            if (e.getSeverity() == AuditEntry.Severity.CRITICAL) {
                incidents.add(new ComplianceReport.Incident(e.getEntryId(), e.getTimestamp(),
                        e.getEventType().name(), e.getActorId(), e.getIpAddress()));
            }
        }

        ComplianceReport report = new ComplianceReport(
                tenantId,
                start.toEpochMilli(),
                end.toEpochMilli(),
                clock.millis(),
                entries.size(),
                byType,
                bySeverity,
                byCategory,
                actors.size(),
                incidents,
                detectAnomalies(entries));

        auditLogService.log(AuditEventRequest.builder()
                .tenantId(tenantId)
                .eventType(AuditEntry.EventType.COMPLIANCE_REPORT_GENERATED)
                .action("report")
                .payload(Map.of(
                        "period_start", report.periodStart(),
                        "period_end", report.periodEnd(),
                        "total_entries", report.totalEntries(),
                        "anomalies", report.anomalies().size()))
                .build());
        return report;
    }

    List<ComplianceReport.Anomaly> detectAnomalies(List<AuditEntry> entries) {
        Map<LocalDate, List<AuditEntry>> byDay = entries.stream()
                .collect(Collectors.groupingBy(e -> day(e.getTimestamp()), TreeMap::new, Collectors.toList()));

        List<ComplianceReport.Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<LocalDate, List<AuditEntry>> day : byDay.entrySet()) {
            long failed = count(day.getValue(), Set.of(AuditEntry.EventType.LOGIN_FAILURE));
            if (failed >= properties.getFailedLoginAlertThreshold()) {
                anomalies.add(new ComplianceReport.Anomaly(day.getKey(), ComplianceReport.Kind.FAILED_AUTHENTICATION,
                        failed, properties.getFailedLoginAlertThreshold()));
            }
            long unauthorized = count(day.getValue(), UNAUTHORIZED);
            if (unauthorized >= properties.getUnauthorizedAccessAlertThreshold()) {
                anomalies.add(new ComplianceReport.Anomaly(day.getKey(), ComplianceReport.Kind.UNAUTHORIZED_ACCESS,
                        unauthorized, properties.getUnauthorizedAccessAlertThreshold()));
            }
        }

        // Spike detection needs a few days of history to mean anything.
        if (byDay.size() >= 3) {
            double mean = byDay.values().stream().mapToInt(List::size).average().orElse(0);
            double variance = byDay.values().stream()
                    .mapToDouble(l -> (l.size() - mean) * (l.size() - mean))
                    .average()
                    .orElse(0);
            double limit = mean + properties.getSpikeStandardDeviations() * Math.sqrt(variance);
            byDay.forEach((d, l) -> {
                if (l.size() > limit) {
                    anomalies.add(new ComplianceReport.Anomaly(d, ComplianceReport.Kind.ACTIVITY_SPIKE, l.size(), limit));
                }
            });
        }
        return anomalies;
    }

    private static long count(List<AuditEntry> entries, Set<AuditEntry.EventType> types) {
        return entries.stream().map(AuditEntry::getEventType).filter(Objects::nonNull).filter(types::contains).count();
    }

    private static LocalDate day(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(ZoneOffset.UTC).toLocalDate();
    }
}
