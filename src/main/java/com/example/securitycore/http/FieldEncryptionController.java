package com.example.securitycore.http;

import com.example.securitycore.models.EncryptedBlob;
import com.example.securitycore.models.Session;
import com.example.securitycore.requests.DecryptFieldHttpRequest;
import com.example.securitycore.requests.EncryptFieldHttpRequest;
import com.example.securitycore.service.AuditLogService;
import com.example.securitycore.service.EncryptionService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Field encryption for callers that cannot embed the library, e.g. the engagement and
 * document services. Decryption of sensitive fields is recorded as data access.
 */
@RestController
public class FieldEncryptionController {

    private final EncryptionService encryptionService;
    private final AuditLogService auditLogService;

    public FieldEncryptionController(EncryptionService encryptionService, AuditLogService auditLogService) {
        this.encryptionService = encryptionService;
        this.auditLogService = auditLogService;
    }

    @PostMapping("/tenants/{tenantId}/fields/encrypt")
    public ResponseEntity<EncryptedFieldResponse> encrypt(@PathVariable String tenantId,
                                                          @Valid @RequestBody EncryptFieldHttpRequest request) {
        EncryptedBlob blob = encryptionService.encryptField(request.plaintext(), request.purpose(), tenantId);
        return ResponseEntity.ok(new EncryptedFieldResponse(blob.encode(), blob.purpose(), blob.keyVersion()));
    }

    @PostMapping("/tenants/{tenantId}/fields/decrypt")
    public ResponseEntity<DecryptedFieldResponse> decrypt(
            @PathVariable String tenantId,
            @Valid @RequestBody DecryptFieldHttpRequest request,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        String plaintext = encryptionService.decryptField(request.ciphertext(), request.purpose(), tenantId);
        auditLogService.logDataAccess(tenantId, session == null ? null : session.getUserId(),
                "encrypted_field", request.purpose(), "decrypt", Map.of());
        return ResponseEntity.ok(new DecryptedFieldResponse(plaintext));
    }
}
