package com.example.securitycore.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record ComplianceReport(
        String tenantId,
        long periodStart,
        long periodEnd,
        long generatedAt,
        int totalEntries,
        Map<String, Long> entriesByEventType,
        Map<String, Long> entriesBySeverity,
        Map<String, Long> entriesByCategory,
        int uniqueActors,
        List<Incident> securityIncidents,
        List<Anomaly> anomalies
) {

    /** A critical entry in the period. */
    public record Incident(String entryId, long timestamp, String eventType, String actorId, String ipAddress) {
    }

    public record Anomaly(LocalDate day, Kind kind, long count, double threshold) {
    }

    public enum Kind {
        FAILED_AUTHENTICATION,
        UNAUTHORIZED_ACCESS,
        ACTIVITY_SPIKE
    }
}
