package com.example.securitycore.http;

import com.example.securitycore.models.Session;
import com.example.securitycore.service.SecurityCoreException;

final class RequestSessions {

    private RequestSessions() {
    }

    // The middleware rejects session-less requests to protected paths; this guards direct use.
    static Session require(Session session) {
        if (session == null) {
            throw SecurityCoreException.authenticationRequired();
        }
        return session;
    }
}
