package com.example.securitycore.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.requests.AuditEventRequest;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ComplianceReportServiceTest {

    private static final String TENANT = "tenant-a";

    private TestServices services;
    private ComplianceReportService reports;

    @BeforeEach
    void setUp() {
        services = new TestServices();
        reports = new ComplianceReportService(services.audit, services.auditProperties, services.clock);
    }

    private void write(AuditEntry.EventType type, String actor, int times) {
        for (int i = 0; i < times; i++) {
            services.audit.log(AuditEventRequest.builder()
                    .tenantId(TENANT)
                    .eventType(type)
                    .actorId(actor)
                    .build());
        }
    }

    private ComplianceReport reportUpToNow() {
        return reports.generateComplianceReport(TENANT, TestServices.START.minus(Duration.ofDays(1)),
                services.clock.instant().plusSeconds(1));
    }

    @Test
    @DisplayName("Counts by type, severity and category with critical incidents listed")
    void summary() {
        write(AuditEntry.EventType.DATA_READ, "alice", 3);
        write(AuditEntry.EventType.DATA_UPDATE, "bob", 2);
        services.audit.logSecurityEvent(TENANT, AuditEntry.EventType.DECRYPTION_FAILURE,
                AuditEntry.Severity.CRITICAL, "mallory", "203.0.113.7", Map.of("reason", "tag_mismatch"));

        ComplianceReport report = reportUpToNow();

        assertEquals(6, report.totalEntries());
        assertEquals(3L, report.entriesByEventType().get("DATA_READ"));
        assertEquals(1L, report.entriesBySeverity().get("CRITICAL"));
        assertEquals(3L, report.entriesByCategory().get("ACCESS"));
        assertEquals(2L, report.entriesByCategory().get("AUDIT"));
        assertEquals(3, report.uniqueActors());
        assertEquals(1, report.securityIncidents().size());
        assertEquals("203.0.113.7", report.securityIncidents().get(0).ipAddress());
        assertTrue(report.anomalies().isEmpty());
    }

    @Test
    @DisplayName("Generating a report is itself audited")
    void reportIsAudited() {
        write(AuditEntry.EventType.DATA_READ, "alice", 1);

        reportUpToNow();

        AuditEntry last = services.auditAccess.findLatest(TENANT).orElseThrow();
        assertEquals(AuditEntry.EventType.COMPLIANCE_REPORT_GENERATED, last.getEventType());
        assertEquals(1, last.getPayload().get("total_entries"));
    }

    @Test
    @DisplayName("Failed logins at the daily threshold are flagged")
    void failedLogins() {
        write(AuditEntry.EventType.LOGIN_FAILURE, "bob", 4);
        assertTrue(reportUpToNow().anomalies().isEmpty());

        write(AuditEntry.EventType.LOGIN_FAILURE, "bob", 1);
        List<ComplianceReport.Anomaly> anomalies = reportUpToNow().anomalies();

        assertEquals(1, anomalies.size());
        assertEquals(ComplianceReport.Kind.FAILED_AUTHENTICATION, anomalies.get(0).kind());
        assertEquals(5, anomalies.get(0).count());
        assertEquals(LocalDate.of(2024, 10, 1), anomalies.get(0).day());
    }

    @Test
    @DisplayName("Unauthorized access attempts and session anomalies share a threshold")
    void unauthorizedAccess() {
        write(AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT, "eve", 2);
        write(AuditEntry.EventType.SESSION_ANOMALY, "eve", 1);

        List<ComplianceReport.Anomaly> anomalies = reportUpToNow().anomalies();

        assertEquals(1, anomalies.size());
        assertEquals(ComplianceReport.Kind.UNAUTHORIZED_ACCESS, anomalies.get(0).kind());
        assertEquals(3, anomalies.get(0).count());
    }

    @Test
    @DisplayName("A day far above the daily mean is reported as a spike")
    void activitySpike() {
        for (int day = 0; day < 14; day++) {
            write(AuditEntry.EventType.DATA_READ, "alice", 2);
            services.clock.advance(Duration.ofDays(1));
        }
        write(AuditEntry.EventType.DATA_READ, "alice", 40);

        List<ComplianceReport.Anomaly> anomalies = reportUpToNow().anomalies();

        assertEquals(1, anomalies.size());
        assertEquals(ComplianceReport.Kind.ACTIVITY_SPIKE, anomalies.get(0).kind());
        assertEquals(LocalDate.of(2024, 10, 15), anomalies.get(0).day());
        assertEquals(40, anomalies.get(0).count());
    }

    @Test
    @DisplayName("Steady activity is not a spike")
    void noSpike() {
        for (int day = 0; day < 10; day++) {
            write(AuditEntry.EventType.DATA_READ, "alice", 5 + day % 2);
            services.clock.advance(Duration.ofDays(1));
        }

        assertTrue(reportUpToNow().anomalies().isEmpty());
    }

    @Test
    @DisplayName("No report is produced over a tampered chain")
    void brokenChain() {
        write(AuditEntry.EventType.DATA_READ, "alice", 3);
        AuditEntry second = services.audit.findEntries(TENANT, 2, 2).get(0);
        second.setAction("rewritten");
        services.auditAccess.delete(second);
        services.auditAccess.append(second);

        assertThrows(ChainIntegrityException.class, this::reportUpToNow);

        assertTrue(services.audit.findEntries(TENANT, 1, Long.MAX_VALUE).stream()
                .noneMatch(e -> e.getEventType() == AuditEntry.EventType.COMPLIANCE_REPORT_GENERATED));
    }

    @Test
    @DisplayName("The period end must follow its start")
    void invalidPeriod() {
        Instant now = services.clock.instant();

        assertThrows(IllegalArgumentException.class, () -> reports.generateComplianceReport(TENANT, now, now));
    }
}
