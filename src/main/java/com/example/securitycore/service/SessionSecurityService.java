package com.example.securitycore.service;

import com.example.securitycore.config.SessionProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.Session;
import com.example.securitycore.requests.AuditEventRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Server-side sessions with idle and absolute expiry, a per-user concurrency cap and
 * optional binding to the client's IP address and user agent.
 *
 * <p>The check against the cap and the insert of a new session happen inside one
 * {@code compute} on the user's entry, so two concurrent logins cannot both slip under it.
 */
@Service
@Slf4j
public class SessionSecurityService {

    private static final Comparator<Session> LEAST_RECENTLY_USED = Comparator
            .comparingLong(Session::getLastSeenAt)
            .thenComparingLong(Session::getCreatedAt)
            .thenComparing(Session::getSessionId);

    private final SessionProperties properties;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    public SessionSecurityService(SessionProperties properties, AuditLogService auditLogService, Clock clock) {
        this.properties = properties;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public Session createSession(String userId, String tenantId, String ipAddress, String userAgent) {
        return createSession(userId, tenantId, ipAddress, userAgent, Set.of());
    }

    /**
     * @throws SessionLimitExceededException if the user is at the cap and the policy is REJECT_NEW
     */
    public Session createSession(String userId, String tenantId, String ipAddress, String userAgent, Set<String> roles) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tenantId, "tenantId");
        long now = clock.millis();
        long absolute = now + properties.getAbsoluteTimeout().toMillis();
        Session created = Session.builder()
                .sessionId(newSessionId())
                .userId(userId)
                .tenantId(tenantId)
                .roles(roles == null ? Set.of() : Set.copyOf(roles))
                .createdAt(now)
                .lastSeenAt(now)
                .expiresAt(Math.min(now + properties.getIdleTimeout().toMillis(), absolute))
                .absoluteExpiry(absolute)
                .ipAddress(ipAddress)
                .userAgentFingerprint(fingerprint(userAgent))
                .build();

        int limit = properties.getMaxConcurrentSessions();
        if (limit < 1) {
            throw new IllegalStateException("security.session.max-concurrent-sessions must be at least 1, was " + limit);
        }
        List<Session> evicted = new ArrayList<>();
        try {
            sessionsByUser.compute(created.userKey(), (key, ids) -> {
                Set<String> live = new HashSet<>();
                if (ids != null) {
                    for (String id : ids) {
                        Session s = sessions.get(id);
                        if (s != null && !isExpired(s, now)) {
                            live.add(id);
                        } else {
                            sessions.remove(id);
                        }
                    }
                }
                while (live.size() >= limit) {
                    if (properties.getConcurrentSessionPolicy() == ConcurrentSessionPolicy.REJECT_NEW) {
                        throw SessionLimitExceededException.of(tenantId, userId, limit);
                    }
                    Session oldest = live.stream()
                            .map(sessions::get)
                            .filter(Objects::nonNull)
                            .min(LEAST_RECENTLY_USED)
                            .orElseThrow();
                    live.remove(oldest.getSessionId());
                    sessions.remove(oldest.getSessionId());
                    evicted.add(oldest);
                }
                sessions.put(created.getSessionId(), created);
                live.add(created.getSessionId());
                return Set.copyOf(live);
            });
        } catch (SessionLimitExceededException ex) {
            auditLogService.logSecurityEvent(tenantId, AuditEntry.EventType.SESSION_LIMIT_EXCEEDED, null,
                    userId, ipAddress, Map.of("limit", limit));
            throw ex;
        }

        for (Session s : evicted) {
            log.info("Evicted session of user {} (tenant {}) to admit a new one", userId, tenantId);
            auditLogService.log(sessionEvent(s, AuditEntry.EventType.SESSION_EVICTED, ipAddress,
                    Map.of("reason", "concurrent_session_limit", "limit", limit)));
        }
        auditLogService.log(sessionEvent(created, AuditEntry.EventType.SESSION_CREATED, ipAddress, Map.of()));
        return created;
    }

    /**
     * Checks the session and slides its idle deadline.
     *
     * @throws SessionExpiredException if the session is unknown or past either deadline
     * @throws SessionAnomalyException if strict binding is on and the IP or user agent changed
     */
    public Session validateSession(String sessionId, String ipAddress, String userAgent) {
        long now = clock.millis();
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw SessionExpiredException.unknown(sessionId);
        }
        if (now > session.getAbsoluteExpiry() || now > session.getExpiresAt()) {
            boolean absolute = now > session.getAbsoluteExpiry();
            removeSession(session);
            auditLogService.log(sessionEvent(session, AuditEntry.EventType.SESSION_EXPIRED, ipAddress,
                    Map.of("reason", absolute ? "absolute_timeout" : "idle_timeout")));
            throw absolute ? SessionExpiredException.absolute(sessionId) : SessionExpiredException.idle(sessionId);
        }
        if (properties.isStrictBinding()) {
            String mismatch = null;
            if (!Objects.equals(session.getIpAddress(), ipAddress)) {
                mismatch = "ip_address";
            } else if (!MessageDigest.isEqual(
                    session.getUserAgentFingerprint().getBytes(StandardCharsets.US_ASCII),
                    fingerprint(userAgent).getBytes(StandardCharsets.US_ASCII))) {
                mismatch = "user_agent";
            }
            if (mismatch != null) {
                removeSession(session);
                Map<String, Object> details = new HashMap<>();
                details.put("mismatch", mismatch);
                details.put("bound_ip", session.getIpAddress());
                auditLogService.logSecurityEvent(session.getTenantId(), AuditEntry.EventType.SESSION_ANOMALY,
                        AuditEntry.Severity.CRITICAL, session.getUserId(), ipAddress, details);
                throw SessionAnomalyException.bindingMismatch(sessionId, mismatch);
            }
        }
        Session renewed = sessions.computeIfPresent(sessionId, (id, s) -> s.toBuilder()
                .lastSeenAt(now)
                .expiresAt(Math.min(now + properties.getIdleTimeout().toMillis(), s.getAbsoluteExpiry()))
                .build());
        if (renewed == null) {
            throw SessionExpiredException.unknown(sessionId);
        }
        return renewed;
    }

    /**
     * Logs the session out. Unknown ids are ignored.
     */
    public void revokeSession(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        removeSession(session);
        auditLogService.log(sessionEvent(session, AuditEntry.EventType.LOGOUT, null, Map.of()));
    }

    public int activeSessionCount(String tenantId, String userId) {
        long now = clock.millis();
        Set<String> ids = sessionsByUser.getOrDefault(Session.userKey(tenantId, userId), Set.of());
        return (int) ids.stream()
                .map(sessions::get)
                .filter(Objects::nonNull)
                .filter(s -> !isExpired(s, now))
                .count();
    }

    @Scheduled(fixedDelayString = "${security.session.cleanup-interval:PT5M}")
    public void purgeExpiredSessions() {
        long now = clock.millis();
        int purged = 0;
        for (Session s : sessions.values()) {
            if (isExpired(s, now)) {
                removeSession(s);
                purged++;
            }
        }
        if (purged > 0) {
            log.debug("Purged {} expired sessions", purged);
        }
    }

    public static String fingerprint(String userAgent) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest((userAgent == null ? "" : userAgent).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private void removeSession(Session session) {
        sessions.remove(session.getSessionId());
        sessionsByUser.computeIfPresent(session.userKey(), (key, ids) -> {
            Set<String> remaining = new HashSet<>(ids);
            remaining.remove(session.getSessionId());
            return remaining.isEmpty() ? null : Set.copyOf(remaining);
        });
    }

    private static boolean isExpired(Session s, long now) {
        return now > s.getExpiresAt() || now > s.getAbsoluteExpiry();
    }

    private String newSessionId() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static AuditEventRequest sessionEvent(Session s, AuditEntry.EventType type, String ipAddress,
                                                  Map<String, Object> details) {
        return AuditEventRequest.builder()
                .tenantId(s.getTenantId())
                .eventType(type)
                .actorId(s.getUserId())
                .resourceType("session")
                .ipAddress(ipAddress != null ? ipAddress : s.getIpAddress())
                .payload(details)
                .build();
    }
}
