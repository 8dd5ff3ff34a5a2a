package com.example.securitycore.service;

public class KeyNotFoundException extends SecurityCoreException {

    private KeyNotFoundException(String message) {
        super(Code.KEY_NOT_FOUND, message);
    }

    public static KeyNotFoundException byId(String keyId) {
        return new KeyNotFoundException("Key " + keyId + " does not exist");
    }

    public static KeyNotFoundException byVersion(String scopeId, int version) {
        return new KeyNotFoundException("Scope " + scopeId + " has no key version " + version);
    }

    public static KeyNotFoundException noActiveKey(String scopeId) {
        return new KeyNotFoundException("Scope " + scopeId + " has no active key");
    }
}
