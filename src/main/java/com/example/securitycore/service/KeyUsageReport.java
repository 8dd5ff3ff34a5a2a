package com.example.securitycore.service;

import com.example.securitycore.models.EncryptionKey;
import java.util.Map;

/**
 * Key inventory and lifecycle activity for one tenant (or all tenants when {@code tenantId} is null).
 */
public record KeyUsageReport(
        String tenantId,
        long periodStart,
        long periodEnd,
        int totalKeys,
        Map<EncryptionKey.KeyType, Long> keysByType,
        Map<EncryptionKey.Status, Long> keysByStatus,
        long keysGenerated,
        long rotations,
        long revocations,
        long destructions,
        long keysDueForRotation
) {
}
