package com.example.securitycore.access;

/**
 * Raised by {@link AuditEntryAccess#append} when another writer already took the sequence
 * slot. The caller re-reads the chain tail and tries again.
 */
public class ChainConflictException extends RuntimeException {

    public ChainConflictException(String tenantId, long sequence, Throwable cause) {
        super("Sequence " + sequence + " of tenant " + tenantId + " is already taken", cause);
    }
}
