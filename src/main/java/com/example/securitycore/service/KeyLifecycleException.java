package com.example.securitycore.service;

import com.example.securitycore.models.EncryptionKey;

/**
 * A requested lifecycle transition is not allowed from the key's current state,
 * or its confirmation did not match.
 */
public class KeyLifecycleException extends SecurityCoreException {

    private KeyLifecycleException(String message) {
        super(Code.KEY_LIFECYCLE_VIOLATION, message);
    }

    private KeyLifecycleException(String message, Throwable cause) {
        super(Code.KEY_LIFECYCLE_VIOLATION, message, cause);
    }

    public static KeyLifecycleException concurrentModification(String scopeId, Throwable cause) {
        return new KeyLifecycleException("Key scope " + scopeId + " kept changing under concurrent writers", cause);
    }

    public static KeyLifecycleException illegalTransition(EncryptionKey key, EncryptionKey.Status target) {
        return new KeyLifecycleException("Key " + key.getKeyId() + " cannot move from "
                + key.getStatus() + " to " + target);
    }

    public static KeyLifecycleException invalidConfirmation(String keyId) {
        return new KeyLifecycleException("Destruction confirmation for key " + keyId + " does not match");
    }
}
