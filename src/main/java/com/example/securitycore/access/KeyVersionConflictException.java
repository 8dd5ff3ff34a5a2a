package com.example.securitycore.access;

/**
 * Raised by {@link EncryptionKeyAccess} when a conditional write loses: the version slot was
 * already taken, or the stored status is no longer the one the caller expected. The caller
 * reloads the scope from storage and decides again.
 */
public class KeyVersionConflictException extends RuntimeException {

    public KeyVersionConflictException(String scopeId, int version, Throwable cause) {
        super("Version " + version + " of key scope " + scopeId + " was changed by another writer", cause);
    }
}
