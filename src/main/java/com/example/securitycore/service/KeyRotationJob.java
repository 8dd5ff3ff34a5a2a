package com.example.securitycore.service;

import com.example.securitycore.models.EncryptionKey;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Rotates every ACTIVE key past its rotation period, then revokes DEPRECATED keys whose
 * grace period has elapsed. Destruction is never automatic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "security.keys.rotation.enabled", havingValue = "true")
public class KeyRotationJob {

    private static final String ACTOR = "key-rotation-job";

    private final KeyManagementService keyManagementService;

    @Scheduled(cron = "${security.keys.rotation.schedule:0 0 3 * * *}")
    public void rotateDueKeys() {
        List<EncryptionKey> due = keyManagementService.checkRotationNeeded();
        log.info("Starting key rotation job: {} keys due for rotation", due.size());

        int rotated = 0;
        int failed = 0;
        for (EncryptionKey key : due) {
            try {
                keyManagementService.rotateKey(key.getKeyId(), ACTOR);
                rotated++;
            } catch (SecurityCoreException ex) {
                failed++;
                log.warn("Failed to rotate key {} of scope {}: {}", key.getKeyId(), key.getScopeId(), ex.getMessage());
            }
        }

        List<EncryptionKey> revoked = keyManagementService.revokeExpiredDeprecatedKeys();
        log.info("Completed key rotation job: rotated={}, failed={}, revoked={}", rotated, failed, revoked.size());
    }
}
