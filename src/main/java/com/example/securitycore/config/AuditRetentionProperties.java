package com.example.securitycore.config;

import com.example.securitycore.models.AuditEntry;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audit log retention.
 * These values are bound from application.yml (audit.retention.*).
 * To enable retention, set audit.retention.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "audit.retention")
@Data
@Validated
public class AuditRetentionProperties {

    private boolean enabled = false;
    private String schedule = "0 0 2 * * *";
    private int auditRetentionDays = 2555;
    private int securityRetentionDays = 730;
    private int accessRetentionDays = 365;

    /** Most purged hashes recorded in one RETENTION_PURGE entry; keeps each entry well under the item size limit. */
    @Min(1)
    private int purgeRecordBatchSize = 1000;

    public int retentionDays(AuditEntry.Category category) {
        return switch (category) {
            case AUDIT -> auditRetentionDays;
            case SECURITY -> securityRetentionDays;
            case ACCESS -> accessRetentionDays;
        };
    }
}
