package com.example.securitycore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Audit ledger settings bound from {@code security.audit.*}.
 */
@Component
@ConfigurationProperties(prefix = "security.audit")
@Data
public class AuditProperties {

    /** Attempts before an append that keeps losing the race on the chain tail gives up. */
    private int maxAppendAttempts = 64;

    /** Failed authentications per day that flag an anomaly in compliance reports. */
    private int failedLoginAlertThreshold = 5;

    /** Unauthorized access or session anomaly events per day that flag an anomaly. */
    private int unauthorizedAccessAlertThreshold = 3;

    /** A day is a spike when its event count exceeds mean + N standard deviations. */
    private double spikeStandardDeviations = 3.0;
}
