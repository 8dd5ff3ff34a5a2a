package com.example.securitycore.service;

/**
 * Authentication of a blob failed: it was altered, or presented under the wrong tenant or
 * purpose. Treated as a security incident and never retried.
 */
public class DecryptionException extends SecurityCoreException {

    private DecryptionException(String message, Throwable cause) {
        super(Code.DECRYPTION_FAILED, message, cause);
    }

    public static DecryptionException tampered(String tenantId, String purpose, int keyVersion, Throwable cause) {
        return new DecryptionException("Authentication failed for " + purpose + " blob of tenant "
                + tenantId + " under key version " + keyVersion, cause);
    }

    public static DecryptionException contextMismatch(String expectedTenant, String expectedPurpose,
                                                      String blobTenant, String blobPurpose) {
        return new DecryptionException("Blob bound to " + blobTenant + "/" + blobPurpose
                + " presented as " + expectedTenant + "/" + expectedPurpose, null);
    }

    public static DecryptionException malformed(Throwable cause) {
        return new DecryptionException("Encrypted value is malformed", cause);
    }
}
