package com.example.securitycore.service;

/**
 * Outcome of a successful chain verification. A failed verification is never returned;
 * it raises {@link ChainIntegrityException}.
 */
public record ChainVerification(
        String tenantId,
        long fromSequence,
        long toSequence,
        int entriesChecked,
        int purgedEntriesAccepted,
        String headHash
) {
}
