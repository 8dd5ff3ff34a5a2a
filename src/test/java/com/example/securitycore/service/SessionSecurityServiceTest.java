package com.example.securitycore.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.securitycore.config.SessionProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.Session;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionSecurityServiceTest {

    private static final String TENANT = "tenant-a";
    private static final String IP = "198.51.100.10";
    private static final String UA = "Mozilla/5.0 (X11; Linux x86_64)";

    private TestServices services;
    private SessionProperties properties;
    private SessionSecurityService sessions;

    @BeforeEach
    void setUp() {
        services = new TestServices();
        properties = new SessionProperties();
        sessions = new SessionSecurityService(properties, services.audit, services.clock);
    }

    private List<AuditEntry> events(AuditEntry.EventType type) {
        return services.audit.findEntries(TENANT, 1, Long.MAX_VALUE).stream()
                .filter(e -> e.getEventType() == type)
                .toList();
    }

    @Test
    @DisplayName("A new session is bound to the client and audited")
    void create() {
        Session s = sessions.createSession("alice", TENANT, IP, UA, Set.of("clinician"));

        assertEquals(43, s.getSessionId().length());
        assertEquals(SessionSecurityService.fingerprint(UA), s.getUserAgentFingerprint());
        assertEquals(services.clock.millis() + Duration.ofMinutes(30).toMillis(), s.getExpiresAt());
        assertEquals(services.clock.millis() + Duration.ofHours(8).toMillis(), s.getAbsoluteExpiry());
        assertTrue(s.hasRole("clinician"));
        assertEquals(1, events(AuditEntry.EventType.SESSION_CREATED).size());
    }

    @Test
    @DisplayName("Validation slides the idle deadline")
    void slidingExpiry() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        services.clock.advance(Duration.ofMinutes(20));
        Session renewed = sessions.validateSession(s.getSessionId(), IP, UA);

        assertEquals(services.clock.millis(), renewed.getLastSeenAt());
        assertEquals(services.clock.millis() + Duration.ofMinutes(30).toMillis(), renewed.getExpiresAt());
    }

    @Test
    @DisplayName("An idle session expires and is gone afterwards")
    void idleExpiry() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        services.clock.advance(Duration.ofMinutes(31));

        SessionExpiredException ex = assertThrows(SessionExpiredException.class,
                () -> sessions.validateSession(s.getSessionId(), IP, UA));
        assertEquals(SecurityCoreException.Code.SESSION_EXPIRED, ex.getCode());
        List<AuditEntry> expired = events(AuditEntry.EventType.SESSION_EXPIRED);
        assertEquals(1, expired.size());
        assertEquals("idle_timeout", expired.get(0).getPayload().get("reason"));
        assertThrows(SessionExpiredException.class, () -> sessions.validateSession(s.getSessionId(), IP, UA));
        assertEquals(0, sessions.activeSessionCount(TENANT, "alice"));
    }

    @Test
    @DisplayName("Activity never extends a session past its absolute lifetime")
    void absoluteExpiry() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        for (int i = 0; i < 24; i++) {
            services.clock.advance(Duration.ofMinutes(20));
            Session renewed = sessions.validateSession(s.getSessionId(), IP, UA);
            assertTrue(renewed.getExpiresAt() <= renewed.getAbsoluteExpiry());
        }
        services.clock.advance(Duration.ofMinutes(1));

        assertThrows(SessionExpiredException.class, () -> sessions.validateSession(s.getSessionId(), IP, UA));
        assertEquals("absolute_timeout",
                events(AuditEntry.EventType.SESSION_EXPIRED).get(0).getPayload().get("reason"));
    }

    @Test
    @DisplayName("A session presented from another IP is destroyed and flagged")
    void ipBinding() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        SessionAnomalyException ex = assertThrows(SessionAnomalyException.class,
                () -> sessions.validateSession(s.getSessionId(), "203.0.113.99", UA));

        assertEquals(SecurityCoreException.Code.SESSION_ANOMALY, ex.getCode());
        List<AuditEntry> anomalies = events(AuditEntry.EventType.SESSION_ANOMALY);
        assertEquals(1, anomalies.size());
        assertEquals(AuditEntry.Severity.CRITICAL, anomalies.get(0).getSeverity());
        assertEquals("ip_address", anomalies.get(0).getPayload().get("mismatch"));
        assertThrows(SessionExpiredException.class, () -> sessions.validateSession(s.getSessionId(), IP, UA));
    }

    @Test
    @DisplayName("A changed user agent is an anomaly too")
    void userAgentBinding() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        assertThrows(SessionAnomalyException.class,
                () -> sessions.validateSession(s.getSessionId(), IP, "curl/8.0"));
        assertEquals("user_agent",
                events(AuditEntry.EventType.SESSION_ANOMALY).get(0).getPayload().get("mismatch"));
    }

    @Test
    @DisplayName("Without strict binding a roaming client keeps its session")
    void relaxedBinding() {
        properties.setStrictBinding(false);
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        Session renewed = sessions.validateSession(s.getSessionId(), "203.0.113.99", "other");

        assertEquals(s.getSessionId(), renewed.getSessionId());
    }

    @Test
    @DisplayName("At the cap the least recently used session is evicted")
    void lruEviction() {
        Session s1 = sessions.createSession("alice", TENANT, IP, UA);
        services.clock.advance(Duration.ofSeconds(1));
        Session s2 = sessions.createSession("alice", TENANT, IP, UA);
        services.clock.advance(Duration.ofSeconds(1));
        Session s3 = sessions.createSession("alice", TENANT, IP, UA);
        services.clock.advance(Duration.ofSeconds(1));
        sessions.validateSession(s1.getSessionId(), IP, UA);

        Session s4 = sessions.createSession("alice", TENANT, IP, UA);

        assertEquals(3, sessions.activeSessionCount(TENANT, "alice"));
        assertThrows(SessionExpiredException.class, () -> sessions.validateSession(s2.getSessionId(), IP, UA));
        sessions.validateSession(s1.getSessionId(), IP, UA);
        sessions.validateSession(s3.getSessionId(), IP, UA);
        sessions.validateSession(s4.getSessionId(), IP, UA);
        assertEquals(1, events(AuditEntry.EventType.SESSION_EVICTED).size());
    }

    @Test
    @DisplayName("REJECT_NEW refuses logins beyond the cap")
    void rejectNew() {
        properties.setConcurrentSessionPolicy(ConcurrentSessionPolicy.REJECT_NEW);
        properties.setMaxConcurrentSessions(2);
        sessions.createSession("alice", TENANT, IP, UA);
        sessions.createSession("alice", TENANT, IP, UA);

        SessionLimitExceededException ex = assertThrows(SessionLimitExceededException.class,
                () -> sessions.createSession("alice", TENANT, IP, UA));

        assertEquals(SecurityCoreException.Code.SESSION_LIMIT_EXCEEDED, ex.getCode());
        assertEquals(2, sessions.activeSessionCount(TENANT, "alice"));
        assertEquals(1, events(AuditEntry.EventType.SESSION_LIMIT_EXCEEDED).size());
        // other users are unaffected
        sessions.createSession("bob", TENANT, IP, UA);
    }

    @Test
    @DisplayName("Expired sessions do not count against the cap")
    void expiredSessionsFreeSlots() {
        properties.setConcurrentSessionPolicy(ConcurrentSessionPolicy.REJECT_NEW);
        properties.setMaxConcurrentSessions(1);
        sessions.createSession("alice", TENANT, IP, UA);

        services.clock.advance(Duration.ofMinutes(31));

        sessions.createSession("alice", TENANT, IP, UA);
        assertEquals(1, sessions.activeSessionCount(TENANT, "alice"));
    }

    @Test
    @DisplayName("Concurrent logins never exceed the cap")
    void concurrentLogins() throws Exception {
        services.auditProperties.setMaxAppendAttempts(10_000);
        int threads = 20;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Session>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return sessions.createSession("alice", TENANT, IP, UA);
                }));
            }
            go.countDown();
            for (Future<Session> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(3, sessions.activeSessionCount(TENANT, "alice"));
        assertEquals(threads - 3, events(AuditEntry.EventType.SESSION_EVICTED).size());
    }

    @Test
    @DisplayName("Logout removes the session and is audited")
    void revoke() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);

        sessions.revokeSession(s.getSessionId());
        sessions.revokeSession(s.getSessionId());

        assertThrows(SessionExpiredException.class, () -> sessions.validateSession(s.getSessionId(), IP, UA));
        assertEquals(1, events(AuditEntry.EventType.LOGOUT).size());
    }

    @Test
    @DisplayName("The sweeper drops expired sessions")
    void purgeExpired() {
        Session s = sessions.createSession("alice", TENANT, IP, UA);
        services.clock.advance(Duration.ofHours(1));

        sessions.purgeExpiredSessions();

        assertEquals(0, sessions.activeSessionCount(TENANT, "alice"));
        assertThrows(SessionExpiredException.class, () -> sessions.validateSession(s.getSessionId(), IP, UA));
    }

    @Test
    @DisplayName("Fingerprints are stable SHA-256 hex")
    void fingerprint() {
        assertEquals(64, SessionSecurityService.fingerprint(UA).length());
        assertEquals(SessionSecurityService.fingerprint(UA), SessionSecurityService.fingerprint(UA));
        assertNotEquals(SessionSecurityService.fingerprint(UA), SessionSecurityService.fingerprint(null));
    }

    @Test
    @DisplayName("Tenant and user ids containing separators are capped independently")
    void separatorInIds() {
        properties.setMaxConcurrentSessions(1);

        Session left = sessions.createSession("c", "a|b", IP, UA, Set.of());
        Session right = sessions.createSession("b|c", "a", IP, UA, Set.of());
        Session hashed = sessions.createSession("b#c", "a", IP, UA, Set.of());

        assertEquals(1, sessions.activeSessionCount("a|b", "c"));
        assertEquals(1, sessions.activeSessionCount("a", "b|c"));
        assertEquals(1, sessions.activeSessionCount("a", "b#c"));
        for (Session s : List.of(left, right, hashed)) {
            assertEquals(s.getSessionId(), sessions.validateSession(s.getSessionId(), IP, UA).getSessionId());
        }
    }

    @Test
    @DisplayName("A cap below one is a configuration error, not a crash mid-login")
    void capBelowOne() {
        properties.setMaxConcurrentSessions(0);

        assertThrows(IllegalStateException.class, () -> sessions.createSession("alice", TENANT, IP, UA, Set.of()));
        assertEquals(0, sessions.activeSessionCount(TENANT, "alice"));
    }
}
