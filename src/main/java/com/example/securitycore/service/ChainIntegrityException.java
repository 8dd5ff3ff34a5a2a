package com.example.securitycore.service;

import lombok.Getter;

/**
 * The audit chain of a tenant no longer verifies. Fatal: automated processing that depends
 * on the ledger stops and the condition needs manual incident response.
 */
@Getter
public class ChainIntegrityException extends SecurityCoreException {

    private final String tenantId;
    private final long sequence;
    private final String reason;

    public ChainIntegrityException(String tenantId, long sequence, String reason) {
        super(Code.CHAIN_INTEGRITY_VIOLATION,
                "Audit chain of tenant " + tenantId + " broken at sequence " + sequence + ": " + reason);
        this.tenantId = tenantId;
        this.sequence = sequence;
        this.reason = reason;
    }
}
