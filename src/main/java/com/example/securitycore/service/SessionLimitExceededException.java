package com.example.securitycore.service;

public class SessionLimitExceededException extends SecurityCoreException {

    private SessionLimitExceededException(String message) {
        super(Code.SESSION_LIMIT_EXCEEDED, message);
    }

    public static SessionLimitExceededException of(String tenantId, String userId, int limit) {
        return new SessionLimitExceededException("User " + userId + " of tenant " + tenantId
                + " already holds " + limit + " sessions");
    }
}
