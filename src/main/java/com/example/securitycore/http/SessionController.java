package com.example.securitycore.http;

import com.example.securitycore.config.IdentityProperties;
import com.example.securitycore.config.MiddlewareProperties;
import com.example.securitycore.models.Session;
import com.example.securitycore.requests.LoginHttpRequest;
import com.example.securitycore.service.AuditLogService;
import com.example.securitycore.service.CredentialVerifier;
import com.example.securitycore.service.CsrfTokenService;
import com.example.securitycore.service.SecurityCoreException;
import com.example.securitycore.service.SessionSecurityService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.HashSet;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login, session introspection and logout. A successful login returns the session id and a
 * CSRF token bound to it; the token is also set as a cookie for browser clients.
 */
@RestController
public class SessionController {

    private final CredentialVerifier credentialVerifier;
    private final SessionSecurityService sessionService;
    private final CsrfTokenService csrfTokens;
    private final AuditLogService auditLogService;
    private final MiddlewareProperties middlewareProperties;

    public SessionController(CredentialVerifier credentialVerifier,
                             SessionSecurityService sessionService,
                             CsrfTokenService csrfTokens,
                             AuditLogService auditLogService,
                             MiddlewareProperties middlewareProperties) {
        this.credentialVerifier = credentialVerifier;
        this.sessionService = sessionService;
        this.csrfTokens = csrfTokens;
        this.auditLogService = auditLogService;
        this.middlewareProperties = middlewareProperties;
    }

    @PostMapping("/sessions/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginHttpRequest request,
                                               HttpServletRequest http) {
        String ip = http.getRemoteAddr();
        Optional<IdentityProperties.Account> account =
                credentialVerifier.authenticate(request.tenantId(), request.userId(), request.password());
        if (account.isEmpty()) {
            auditLogService.logAuthenticationAttempt(request.tenantId(), request.userId(), false, ip,
                    "invalid_credentials");
            throw SecurityCoreException.invalidCredentials(request.tenantId(), request.userId());
        }
        auditLogService.logAuthenticationAttempt(request.tenantId(), request.userId(), true, ip, null);

        Session session = sessionService.createSession(request.userId(), request.tenantId(), ip,
                http.getHeader(HttpHeaders.USER_AGENT), new HashSet<>(account.get().getRoles()));
        String csrfToken = csrfTokens.issue(session.getSessionId());

        ResponseCookie cookie = ResponseCookie.from(middlewareProperties.getCsrf().getCookieName(), csrfToken)
                .path("/")
                .secure(true)
                .sameSite("Strict")
                .maxAge(middlewareProperties.getCsrf().getTokenTtl())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new LoginResponse(session.getSessionId(), csrfToken,
                        session.getExpiresAt(), session.getAbsoluteExpiry()));
    }

    @GetMapping("/sessions/current")
    public ResponseEntity<SessionResponse> current(
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        Session s = RequestSessions.require(session);
        return ResponseEntity.ok(new SessionResponse(
                s.getUserId(),
                s.getTenantId(),
                s.getRoles(),
                s.getCreatedAt(),
                s.getExpiresAt(),
                s.getAbsoluteExpiry(),
                sessionService.activeSessionCount(s.getTenantId(), s.getUserId())));
    }

    /**
     * Ends a session. Users may end their own sessions; security administrators may end any.
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> logout(
            @PathVariable String sessionId,
            @RequestAttribute(name = SecurityMiddlewareFilter.SESSION_ATTRIBUTE, required = false) Session session) {
        Session s = RequestSessions.require(session);
        if (!s.getSessionId().equals(sessionId) && !s.hasRole(middlewareProperties.getAdminRole())) {
            throw SecurityCoreException.accessDenied("Session " + s.getUserId() + " may not end another session");
        }
        sessionService.revokeSession(sessionId);
        csrfTokens.invalidate(sessionId);
        return ResponseEntity.noContent().build();
    }
}
