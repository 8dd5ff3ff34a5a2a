package com.example.securitycore.service;

public class SessionAnomalyException extends SecurityCoreException {

    private SessionAnomalyException(String message) {
        super(Code.SESSION_ANOMALY, message);
    }

    public static SessionAnomalyException bindingMismatch(String sessionId, String attribute) {
        return new SessionAnomalyException("Session " + sessionId + " presented with a different " + attribute);
    }
}
