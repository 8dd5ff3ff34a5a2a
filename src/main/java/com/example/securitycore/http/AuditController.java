package com.example.securitycore.http;

import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.Session;
import com.example.securitycore.requests.AuditEventRequest;
import com.example.securitycore.service.AuditLogService;
import com.example.securitycore.service.ChainVerification;
import com.example.securitycore.service.ComplianceReport;
import com.example.securitycore.service.ComplianceReportService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to a tenant's audit chain for security administrators and auditors.
 */
@RestController
@RequestMapping("/admin/tenants/{tenantId}")
public class AuditController {

    private static final long MAX_PAGE = 1000;

    private final AuditLogService auditLogService;
    private final ComplianceReportService complianceReportService;

    public AuditController(AuditLogService auditLogService, ComplianceReportService complianceReportService) {
        this.auditLogService = auditLogService;
        this.complianceReportService = complianceReportService;
    }

    @GetMapping("/audit-entries")
    public ResponseEntity<List<AuditEntryResponse>> entries(@PathVariable String tenantId,
                                                            @RequestParam(name = "from", defaultValue = "1") long from,
                                                            @RequestParam(name = "limit", defaultValue = "100") long limit) {
        if (from < 1 || limit < 1 || limit > MAX_PAGE) {
            throw new IllegalArgumentException("from must be >= 1 and limit between 1 and " + MAX_PAGE);
        }
        List<AuditEntry> entries = auditLogService.findEntries(tenantId, from, from + limit - 1);
        return ResponseEntity.ok(entries.stream().map(AuditEntryResponse::of).toList());
    }

    @GetMapping("/audit-chain/verify")
    public ResponseEntity<ChainVerification> verify(
            @PathVariable String tenantId,
            @RequestParam(name = "from", defaultValue = "1") long from,
            @RequestParam(name = "to", required = false) Long to,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        ChainVerification result = auditLogService.verifyChain(tenantId, from, to == null ? Long.MAX_VALUE : to);
        auditLogService.log(AuditEventRequest.builder()
                .tenantId(tenantId)
                .eventType(AuditEntry.EventType.CHAIN_VERIFIED)
                .actorId(session == null ? null : session.getUserId())
                .action("verify")
                .payload(Map.of("entries_checked", result.entriesChecked(), "to_sequence", result.toSequence()))
                .build());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/compliance-report")
    public ResponseEntity<ComplianceReport> complianceReport(@PathVariable String tenantId,
                                                             @RequestParam("start") Instant start,
                                                             @RequestParam("end") Instant end) {
        return ResponseEntity.ok(complianceReportService.generateComplianceReport(tenantId, start, end));
    }
}
