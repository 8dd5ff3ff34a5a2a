package com.example.securitycore.http;

import com.example.securitycore.models.EncryptionKey;
import com.example.securitycore.models.Session;
import com.example.securitycore.requests.DestroyKeyHttpRequest;
import com.example.securitycore.requests.GenerateKeyHttpRequest;
import com.example.securitycore.requests.RevokeKeyHttpRequest;
import com.example.securitycore.service.KeyManagementService;
import com.example.securitycore.service.KeyUsageReport;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Key lifecycle administration. Reachable only with the security administrator role.
 */
@RestController
@RequestMapping("/admin/keys")
public class KeyAdminController {

    private final KeyManagementService keyManagementService;

    public KeyAdminController(KeyManagementService keyManagementService) {
        this.keyManagementService = keyManagementService;
    }

    @GetMapping
    public ResponseEntity<List<KeyResponse>> list(@RequestParam(name = "tenant_id", required = false) String tenantId,
                                                  @RequestParam(name = "type", required = false) EncryptionKey.KeyType type,
                                                  @RequestParam(name = "status", required = false) EncryptionKey.Status status) {
        return ResponseEntity.ok(keyManagementService.listKeys(tenantId, type, status).stream()
                .map(KeyResponse::of)
                .toList());
    }

    @PostMapping
    public ResponseEntity<KeyResponse> generate(
            @Valid @RequestBody GenerateKeyHttpRequest request,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        EncryptionKey key = keyManagementService.generateKey(request.type(), request.purpose(), request.tenantId(),
                RequestSessions.require(session).getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(KeyResponse.of(key));
    }

    @PostMapping("/{keyId}/rotate")
    public ResponseEntity<KeyResponse> rotate(
            @PathVariable String keyId,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        return ResponseEntity.ok(KeyResponse.of(
                keyManagementService.rotateKey(keyId, RequestSessions.require(session).getUserId())));
    }

    @PostMapping("/{keyId}/revoke")
    public ResponseEntity<KeyResponse> revoke(
            @PathVariable String keyId,
            @Valid @RequestBody RevokeKeyHttpRequest request,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        return ResponseEntity.ok(KeyResponse.of(keyManagementService.revokeKey(keyId, request.reason(),
                RequestSessions.require(session).getUserId())));
    }

    @PostMapping("/{keyId}/destroy")
    public ResponseEntity<KeyResponse> destroy(
            @PathVariable String keyId,
            @Valid @RequestBody DestroyKeyHttpRequest request,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        return ResponseEntity.ok(KeyResponse.of(keyManagementService.destroyKey(keyId, request.confirmation(),
                RequestSessions.require(session).getUserId())));
    }

    @GetMapping("/rotation-due")
    public ResponseEntity<List<KeyResponse>> rotationDue() {
        return ResponseEntity.ok(keyManagementService.checkRotationNeeded().stream()
                .map(KeyResponse::of)
                .toList());
    }

    @GetMapping("/usage-report")
    public ResponseEntity<KeyUsageReport> usageReport(@RequestParam(name = "tenant_id", required = false) String tenantId,
                                                      @RequestParam("start") Instant start,
                                                      @RequestParam("end") Instant end) {
        return ResponseEntity.ok(keyManagementService.keyUsageReport(tenantId, start.toEpochMilli(), end.toEpochMilli()));
    }
}
