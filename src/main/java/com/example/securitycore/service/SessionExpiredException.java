package com.example.securitycore.service;

import lombok.Getter;

public class SessionExpiredException extends SecurityCoreException {

    /** True when the id never named a live session, as opposed to one that timed out. */
    @Getter
    private final boolean unknown;

    private SessionExpiredException(String message, boolean unknown) {
        super(Code.SESSION_EXPIRED, message);
        this.unknown = unknown;
    }

    public static SessionExpiredException idle(String sessionId) {
        return new SessionExpiredException("Session " + sessionId + " exceeded its idle timeout", false);
    }

    public static SessionExpiredException absolute(String sessionId) {
        return new SessionExpiredException("Session " + sessionId + " exceeded its absolute lifetime", false);
    }

    public static SessionExpiredException unknown(String sessionId) {
        return new SessionExpiredException("Session " + sessionId + " does not exist", true);
    }
}
