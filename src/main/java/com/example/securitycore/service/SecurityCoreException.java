package com.example.securitycore.service;

import lombok.Getter;

/**
 * Base of every failure the security core reports to callers. The message is for the
 * audit log and operators; the HTTP layer only exposes the {@link Code}.
 */
public class SecurityCoreException extends RuntimeException {

    public enum Code {
        DECRYPTION_FAILED,
        KEY_UNAVAILABLE,
        KEY_NOT_FOUND,
        KEY_LIFECYCLE_VIOLATION,
        SESSION_EXPIRED,
        SESSION_ANOMALY,
        SESSION_LIMIT_EXCEEDED,
        RATE_LIMIT_EXCEEDED,
        CHAIN_INTEGRITY_VIOLATION,
        ACCESS_DENIED,
        AUTHENTICATION_REQUIRED,
        INVALID_CREDENTIALS,
        IP_BLOCKED,
        CSRF_VIOLATION,
        AUDIT_UNAVAILABLE
    }

    @Getter
    private final Code code;

    protected SecurityCoreException(Code code, String message) {
        super(message);
        this.code = code;
    }

    protected SecurityCoreException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static SecurityCoreException accessDenied(String message) {
        return new SecurityCoreException(Code.ACCESS_DENIED, message);
    }

    public static SecurityCoreException authenticationRequired() {
        return new SecurityCoreException(Code.AUTHENTICATION_REQUIRED, "A valid session is required");
    }

    public static SecurityCoreException invalidCredentials(String tenantId, String userId) {
        return new SecurityCoreException(Code.INVALID_CREDENTIALS,
                "Login rejected for user " + userId + " of tenant " + tenantId);
    }

    public static SecurityCoreException auditUnavailable(Throwable cause) {
        return new SecurityCoreException(Code.AUDIT_UNAVAILABLE,
                "Audit ledger could not record the event", cause);
    }
}
