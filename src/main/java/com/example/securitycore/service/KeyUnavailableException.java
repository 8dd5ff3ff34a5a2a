package com.example.securitycore.service;

import com.example.securitycore.models.EncryptionKey;

public class KeyUnavailableException extends SecurityCoreException {

    private KeyUnavailableException(String message) {
        super(Code.KEY_UNAVAILABLE, message);
    }

    public static KeyUnavailableException of(EncryptionKey key) {
        return new KeyUnavailableException("Key " + key.getKeyId() + " (scope " + key.getScopeId()
                + ", version " + key.getVersion() + ") is " + key.getStatus());
    }
}
