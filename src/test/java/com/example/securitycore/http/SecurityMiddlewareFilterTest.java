package com.example.securitycore.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.example.securitycore.access.InMemoryAuditEntryAccess;
import com.example.securitycore.config.AuditProperties;
import com.example.securitycore.config.MiddlewareProperties;
import com.example.securitycore.config.SessionProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.Session;
import com.example.securitycore.service.AuditLogService;
import com.example.securitycore.service.CsrfTokenService;
import com.example.securitycore.service.IpAccessList;
import com.example.securitycore.service.MutableClock;
import com.example.securitycore.service.RateLimiterService;
import com.example.securitycore.service.SecurityCoreException;
import com.example.securitycore.service.SessionSecurityService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class SecurityMiddlewareFilterTest {

    private static final String IP = "198.51.100.10";
    private static final String UA = "Mozilla/5.0";
    private static final String TENANT = "tenant-a";

    private MutableClock clock;
    private MiddlewareProperties properties;
    private InMemoryAuditEntryAccess auditAccess;
    private AuditLogService audit;
    private IpAccessList ipAccessList;
    private SessionSecurityService sessions;
    private CsrfTokenService csrfTokens;
    private SecurityMiddlewareFilter filter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-10-01T12:34:56Z"));
        properties = new MiddlewareProperties();
        auditAccess = new InMemoryAuditEntryAccess();
        audit = new AuditLogService(auditAccess, new AuditProperties(), clock);
        ipAccessList = new IpAccessList(properties);
        sessions = new SessionSecurityService(new SessionProperties(), audit, clock);
        csrfTokens = new CsrfTokenService(properties, clock);
        filter = newFilter(audit);
    }

    private SecurityMiddlewareFilter newFilter(AuditLogService auditLogService) {
        return new SecurityMiddlewareFilter(properties, ipAccessList, sessions,
                new RateLimiterService(properties, clock), csrfTokens, auditLogService, new ObjectMapper());
    }

    private static MockHttpServletRequest request(String method, String uri) {
        MockHttpServletRequest req = new MockHttpServletRequest(method, uri);
        req.setRemoteAddr(IP);
        req.addHeader(HttpHeaders.USER_AGENT, UA);
        return req;
    }

    private static MockHttpServletRequest request(String method, String uri, Session session) {
        MockHttpServletRequest req = request(method, uri);
        req.addHeader(SecurityMiddlewareFilter.SESSION_HEADER, session.getSessionId());
        return req;
    }

    private record Outcome(MockHttpServletResponse response, MockFilterChain chain) {
        boolean passed() {
            return chain.getRequest() != null;
        }
    }

    private Outcome run(MockHttpServletRequest req) throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(req, res, chain);
        return new Outcome(res, chain);
    }

    private List<AuditEntry> events(String tenant, AuditEntry.EventType type) {
        return audit.findEntries(tenant, 1, Long.MAX_VALUE).stream()
                .filter(e -> e.getEventType() == type)
                .toList();
    }

    private Session login(Set<String> roles) {
        return sessions.createSession("alice", TENANT, IP, UA, roles);
    }

    @Test
    @DisplayName("Security headers are set on accepted and rejected responses")
    void securityHeaders() throws Exception {
        Outcome rejected = run(request("GET", "/tenants/tenant-a/things"));
        Outcome accepted = run(request("GET", "/tenants/tenant-a/things", login(Set.of())));

        for (Outcome o : List.of(rejected, accepted)) {
            MockHttpServletResponse res = o.response();
            assertTrue(res.getHeader("Strict-Transport-Security").startsWith("max-age=31536000"));
            assertTrue(res.getHeader("Content-Security-Policy").contains("frame-ancestors 'none'"));
            assertEquals("DENY", res.getHeader("X-Frame-Options"));
            assertEquals("nosniff", res.getHeader("X-Content-Type-Options"));
            assertEquals("1; mode=block", res.getHeader("X-XSS-Protection"));
            assertEquals("strict-origin-when-cross-origin", res.getHeader("Referrer-Policy"));
            assertNotNull(res.getHeader("Permissions-Policy"));
        }
        assertTrue(accepted.passed());
    }

    @Test
    @DisplayName("Excluded paths bypass the middleware entirely")
    void excludedPaths() throws Exception {
        Outcome o = run(request("GET", "/health"));

        assertTrue(o.passed());
        assertNull(o.response().getHeader("X-Frame-Options"));
    }

    @Test
    @DisplayName("Protected paths need a session; the refusal is audited")
    void sessionRequired() throws Exception {
        Outcome o = run(request("GET", "/tenants/tenant-a/things"));

        assertEquals(401, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("\"code\":\"AUTHENTICATION_REQUIRED\""));
        List<AuditEntry> attempts = events(AuditLogService.SYSTEM_TENANT, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT);
        assertEquals(1, attempts.size());
        assertEquals(IP, attempts.get(0).getIpAddress());
    }

    @Test
    @DisplayName("Login is public and exempt from CSRF")
    void loginIsPublic() throws Exception {
        assertTrue(run(request("POST", "/sessions/login")).passed());
    }

    @Test
    @DisplayName("CORS preflight passes without a session")
    void preflight() throws Exception {
        assertTrue(run(request("OPTIONS", "/tenants/tenant-a/fields/encrypt")).passed());
    }

    @Test
    @DisplayName("A valid session is exposed to the handler")
    void sessionAttribute() throws Exception {
        Session session = login(Set.of());

        Outcome o = run(request("GET", "/sessions/current", session));

        assertTrue(o.passed());
        Session seen = (Session) o.chain().getRequest().getAttribute(SecurityMiddlewareFilter.SESSION_ATTRIBUTE);
        assertEquals(session.getSessionId(), seen.getSessionId());
        assertEquals("1000", o.response().getHeader("X-RateLimit-Limit"));
        assertEquals("999", o.response().getHeader("X-RateLimit-Remaining"));
    }

    @Test
    @DisplayName("Deny-listed addresses are refused before anything else")
    void denyList() throws Exception {
        properties.getIp().setDenyList(List.of(IP));

        Outcome o = run(request("POST", "/sessions/login"));

        assertEquals(403, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("IP_BLOCKED"));
        assertEquals(1, events(AuditLogService.SYSTEM_TENANT, AuditEntry.EventType.IP_BLOCKED).size());
    }

    @Test
    @DisplayName("A session from another tenant cannot reach this tenant's paths")
    void crossTenant() throws Exception {
        Session session = login(Set.of());

        Outcome o = run(request("GET", "/tenants/tenant-b/fields", session));

        assertEquals(403, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("ACCESS_DENIED"));
        List<AuditEntry> attempts = events(TENANT, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT);
        assertEquals(1, attempts.size());
        assertEquals("cross_tenant", attempts.get(0).getPayload().get("reason"));
        assertEquals(1, ipAccessList.violationCount(IP));
    }

    @Test
    @DisplayName("Admin paths need the admin role")
    void adminRole() throws Exception {
        Outcome denied = run(request("GET", "/admin/keys", login(Set.of("clinician"))));
        Outcome allowed = run(request("GET", "/admin/keys", login(Set.of("security_admin"))));

        assertEquals(403, denied.response().getStatus());
        assertTrue(allowed.passed());
    }

    @Test
    @DisplayName("State-changing requests need the session's CSRF token in a header or cookie")
    void csrf() throws Exception {
        Session session = login(Set.of());
        String token = csrfTokens.issue(session.getSessionId());

        Outcome missing = run(request("POST", "/tenants/tenant-a/fields/encrypt", session));
        assertEquals(403, missing.response().getStatus());
        assertTrue(missing.response().getContentAsString().contains("CSRF_VIOLATION"));
        assertEquals(1, events(TENANT, AuditEntry.EventType.CSRF_VIOLATION).size());

        MockHttpServletRequest withHeader = request("POST", "/tenants/tenant-a/fields/encrypt", session);
        withHeader.addHeader("X-CSRF-Token", token);
        assertTrue(run(withHeader).passed());

        MockHttpServletRequest withCookie = request("DELETE", "/sessions/" + session.getSessionId(), session);
        withCookie.setCookies(new Cookie("csrf_token", token));
        assertTrue(run(withCookie).passed());

        MockHttpServletRequest bearer = request("POST", "/tenants/tenant-a/fields/encrypt", session);
        bearer.addHeader(HttpHeaders.AUTHORIZATION, "Bearer service-token");
        assertTrue(run(bearer).passed());

        assertTrue(run(request("GET", "/tenants/tenant-a/fields", session)).passed());
    }

    @Test
    @DisplayName("A hijacked session is refused and counted against the address")
    void sessionAnomaly() throws Exception {
        Session session = login(Set.of());
        MockHttpServletRequest req = request("GET", "/sessions/current", session);
        req.setRemoteAddr("203.0.113.50");

        Outcome o = run(req);

        assertEquals(401, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("SESSION_ANOMALY"));
        assertEquals(1, ipAccessList.violationCount("203.0.113.50"));
    }

    @Test
    @DisplayName("An expired session is refused")
    void sessionExpired() throws Exception {
        Session session = login(Set.of());
        clock.advance(Duration.ofMinutes(31));

        Outcome o = run(request("GET", "/sessions/current", session));

        assertEquals(401, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("SESSION_EXPIRED"));
    }

    @Test
    @DisplayName("The sixth login attempt in five minutes is throttled")
    void loginRateLimit() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertTrue(run(request("POST", "/sessions/login")).passed());
        }

        Outcome o = run(request("POST", "/sessions/login"));

        assertEquals(429, o.response().getStatus());
        assertEquals("300", o.response().getHeader(HttpHeaders.RETRY_AFTER));
        assertEquals("5", o.response().getHeader("X-RateLimit-Limit"));
        assertEquals("0", o.response().getHeader("X-RateLimit-Remaining"));
        assertEquals(1, events(AuditLogService.SYSTEM_TENANT, AuditEntry.EventType.RATE_LIMIT_EXCEEDED).size());

        clock.advance(Duration.ofMinutes(5));
        assertTrue(run(request("POST", "/sessions/login")).passed());
    }

    @Test
    @DisplayName("Repeated violations block the address")
    void autoBlock() throws Exception {
        properties.getIp().setAutoBlockThreshold(2);
        Session session = login(Set.of());

        run(request("GET", "/tenants/tenant-b/x", session));
        run(request("GET", "/tenants/tenant-b/x", session));
        Outcome o = run(request("GET", "/tenants/tenant-a/x", session));

        assertEquals(403, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("IP_BLOCKED"));
        List<AuditEntry> blocks = events(AuditLogService.SYSTEM_TENANT, AuditEntry.EventType.IP_BLOCKED);
        assertEquals(2, blocks.size());
        assertEquals(2, blocks.get(0).getPayload().get("violations"));
    }

    @Test
    @DisplayName("If the rejection cannot be audited the request still fails, with 503")
    void auditUnavailable() throws Exception {
        AuditLogService failing = mock(AuditLogService.class);
        when(failing.logSecurityEvent(isNull(), any(), isNull(), isNull(), any(), anyMap()))
                .thenThrow(SecurityCoreException.auditUnavailable(new IllegalStateException("ledger down")));
        filter = newFilter(failing);

        Outcome o = run(request("GET", "/tenants/tenant-a/things"));

        assertEquals(503, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("AUDIT_UNAVAILABLE"));
    }

    @Test
    @DisplayName("An unknown session id is refused and the attempt is audited")
    void unknownSession() throws Exception {
        MockHttpServletRequest req = request("GET", "/sessions/current");
        req.addHeader(SecurityMiddlewareFilter.SESSION_HEADER, "no-such-session");

        Outcome o = run(req);

        assertEquals(401, o.response().getStatus());
        assertTrue(o.response().getContentAsString().contains("SESSION_EXPIRED"));
        List<AuditEntry> attempts = events(AuditLogService.SYSTEM_TENANT, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT);
        assertEquals(1, attempts.size());
        assertEquals("unknown_session", attempts.get(0).getPayload().get("reason"));
        assertEquals(IP, attempts.get(0).getIpAddress());
    }

    @Test
    @DisplayName("A session refusal that cannot be audited fails with 503")
    void sessionAuditUnavailable() throws Exception {
        AuditLogService failing = spy(audit);
        sessions = new SessionSecurityService(new SessionProperties(), failing, clock);
        filter = newFilter(failing);
        Session hijacked = login(Set.of());
        Session expired = login(Set.of());
        doThrow(SecurityCoreException.auditUnavailable(new IllegalStateException("ledger down")))
                .when(failing).log(any());
        doThrow(SecurityCoreException.auditUnavailable(new IllegalStateException("ledger down")))
                .when(failing).logSecurityEvent(any(), any(), any(), any(), any(), anyMap());

        MockHttpServletRequest elsewhere = request("GET", "/sessions/current", hijacked);
        elsewhere.setRemoteAddr("203.0.113.50");
        Outcome anomaly = run(elsewhere);
        clock.advance(Duration.ofMinutes(31));
        Outcome timedOut = run(request("GET", "/sessions/current", expired));

        for (Outcome o : List.of(anomaly, timedOut)) {
            assertEquals(503, o.response().getStatus());
            assertTrue(o.response().getContentAsString().contains("AUDIT_UNAVAILABLE"));
            assertFalse(o.passed());
        }
    }
}
