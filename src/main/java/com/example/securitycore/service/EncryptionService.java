package com.example.securitycore.service;

import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.EncryptedBlob;
import com.example.securitycore.models.EncryptedDocument;
import com.example.securitycore.models.KeyScope;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import javax.crypto.AEADBadTagException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Field-level AES-256-GCM encryption under per (tenant, purpose) DATA keys. Every blob is
 * bound to its tenant, purpose and key version through the GCM associated data, so it only
 * decrypts in the context it was produced for.
 */
@Service
@Slf4j
public class EncryptionService {

    private final KeyManagementService keyManagementService;
    private final AesGcmCipher cipher;
    private final AuditLogService auditLogService;

    public EncryptionService(KeyManagementService keyManagementService,
                             AesGcmCipher cipher,
                             AuditLogService auditLogService) {
        this.keyManagementService = keyManagementService;
        this.cipher = cipher;
        this.auditLogService = auditLogService;
    }

    public EncryptedBlob encryptField(String plaintext, String purpose, String tenantId) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        return encryptBytes(plaintext.getBytes(StandardCharsets.UTF_8), purpose, tenantId);
    }

    public String decryptField(EncryptedBlob blob, String purpose, String tenantId) {
        return new String(decryptBytes(blob, purpose, tenantId), StandardCharsets.UTF_8);
    }

    /**
     * Decrypts the string form produced by {@link EncryptedBlob#encode()}.
     */
    public String decryptField(String encoded, String purpose, String tenantId) {
        EncryptedBlob blob;
        try {
            blob = EncryptedBlob.parse(encoded);
        } catch (IllegalArgumentException ex) {
            recordFailure(tenantId, purpose, null, "malformed");
            throw DecryptionException.malformed(ex);
        }
        return decryptField(blob, purpose, tenantId);
    }

    /**
     * Envelope encryption for large payloads: a fresh data key seals the document and is
     * itself encrypted under the active purpose key.
     */
    public EncryptedDocument encryptDocument(byte[] document, String purpose, String tenantId) {
        byte[] dataKey = cipher.newKey();
        EncryptedBlob wrappedKey = encryptBytes(dataKey, purpose, tenantId);
        AesGcmCipher.Sealed sealed = cipher.seal(dataKey, document, documentContext(wrappedKey));
        log.debug("Encrypted {} byte document for tenant {} under {} v{}",
                document.length, tenantId, wrappedKey.purpose(), wrappedKey.keyVersion());
        return new EncryptedDocument(wrappedKey, sealed.nonce(), sealed.ciphertext(), sealed.tag());
    }

    public byte[] decryptDocument(EncryptedDocument document, String purpose, String tenantId) {
        EncryptedBlob wrappedKey = document.wrappedKey();
        byte[] dataKey = decryptBytes(wrappedKey, purpose, tenantId);
        try {
            return cipher.open(dataKey, document.nonce(), document.ciphertext(), document.tag(),
                    documentContext(wrappedKey));
        } catch (AEADBadTagException ex) {
            recordFailure(tenantId, wrappedKey.purpose(), wrappedKey.keyVersion(), "document_tag_mismatch");
            throw DecryptionException.tampered(tenantId, wrappedKey.purpose(), wrappedKey.keyVersion(), ex);
        }
    }

    private EncryptedBlob encryptBytes(byte[] plaintext, String purpose, String tenantId) {
        KeyManagementService.ResolvedKey resolved = keyManagementService.activeDataKey(purpose, tenantId);
        String scopedPurpose = resolved.key().getPurpose();
        int version = resolved.key().getVersion();
        byte[] material = resolved.material();
        AesGcmCipher.Sealed sealed;
        try {
            sealed = cipher.seal(material, plaintext, EncryptedBlob.associatedData(tenantId, scopedPurpose, version));
        } finally {
            Arrays.fill(material, (byte) 0);
        }
        return new EncryptedBlob(tenantId, scopedPurpose, version, sealed.nonce(), sealed.ciphertext(), sealed.tag());
    }

    private byte[] decryptBytes(EncryptedBlob blob, String purpose, String tenantId) {
        if (purpose == null || purpose.isBlank() || tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("purpose and tenantId must be non-blank");
        }
        String expectedPurpose = KeyScope.normalizePurpose(purpose);
        if (!blob.tenantId().equals(tenantId) || !blob.purpose().equals(expectedPurpose)) {
            recordFailure(tenantId, expectedPurpose, blob.keyVersion(), "context_mismatch");
            throw DecryptionException.contextMismatch(tenantId, expectedPurpose, blob.tenantId(), blob.purpose());
        }

        KeyManagementService.ResolvedKey resolved;
        try {
            resolved = keyManagementService.dataKeyVersion(expectedPurpose, tenantId, blob.keyVersion());
        } catch (KeyUnavailableException ex) {
            auditLogService.logSecurityEvent(tenantId, AuditEntry.EventType.KEY_ACCESS_DENIED, null, null, null,
                    Map.of("purpose", expectedPurpose, "key_version", blob.keyVersion()));
            throw ex;
        }

        byte[] material = resolved.material();
        try {
            return cipher.open(material, blob.nonce(), blob.ciphertext(), blob.tag(),
                    EncryptedBlob.associatedData(tenantId, expectedPurpose, blob.keyVersion()));
        } catch (AEADBadTagException ex) {
            recordFailure(tenantId, expectedPurpose, blob.keyVersion(), "tag_mismatch");
            throw DecryptionException.tampered(tenantId, expectedPurpose, blob.keyVersion(), ex);
        } finally {
            Arrays.fill(material, (byte) 0);
        }
    }

    private void recordFailure(String tenantId, String purpose, Integer keyVersion, String reason) {
        log.warn("Decryption failure for tenant {} purpose {}: {}", tenantId, purpose, reason);
        Map<String, Object> details = new HashMap<>();
        details.put("purpose", purpose);
        details.put("reason", reason);
        if (keyVersion != null) {
            details.put("key_version", keyVersion);
        }
        auditLogService.logSecurityEvent(tenantId, AuditEntry.EventType.DECRYPTION_FAILURE,
                AuditEntry.Severity.CRITICAL, null, null, details);
    }

    private static byte[] documentContext(EncryptedBlob wrappedKey) {
        return ("esc1-doc|" + wrappedKey.tenantId() + "|" + wrappedKey.purpose() + "|" + wrappedKey.keyVersion())
                .getBytes(StandardCharsets.UTF_8);
    }
}
