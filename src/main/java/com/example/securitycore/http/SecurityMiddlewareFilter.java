package com.example.securitycore.http;

import com.example.securitycore.config.MiddlewareProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.Session;
import com.example.securitycore.service.AuditLogService;
import com.example.securitycore.service.CsrfTokenService;
import com.example.securitycore.service.IpAccessList;
import com.example.securitycore.service.RateLimitExceededException;
import com.example.securitycore.service.RateLimiterService;
import com.example.securitycore.service.SecurityCoreException;
import com.example.securitycore.service.SessionAnomalyException;
import com.example.securitycore.service.SessionExpiredException;
import com.example.securitycore.service.SessionSecurityService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Request-boundary enforcement, in order: IP lists, session validation, rate limiting,
 * CSRF, tenant and admin authorisation. Security headers are set on every response,
 * rejections included.
 *
 * <p>Every rejection is written to the audit ledger before the response goes out. If that
 * write fails the request is still refused, with 503.
 */
@Slf4j
public class SecurityMiddlewareFilter extends OncePerRequestFilter {

    public static final String SESSION_HEADER = "X-Session-Id";
    public static final String SESSION_ATTRIBUTE = "securitycore.session";

    private static final Set<String> STATE_CHANGING = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final String TENANT_PREFIX = "/tenants/";

    private final MiddlewareProperties properties;
    private final IpAccessList ipAccessList;
    private final SessionSecurityService sessionService;
    private final RateLimiterService rateLimiter;
    private final CsrfTokenService csrfTokens;
    private final AuditLogService auditLogService;
    private final ObjectMapper objectMapper;

    public SecurityMiddlewareFilter(MiddlewareProperties properties,
                                    IpAccessList ipAccessList,
                                    SessionSecurityService sessionService,
                                    RateLimiterService rateLimiter,
                                    CsrfTokenService csrfTokens,
                                    AuditLogService auditLogService,
                                    ObjectMapper objectMapper) {
        this.properties = properties;
        this.ipAccessList = ipAccessList;
        this.sessionService = sessionService;
        this.rateLimiter = rateLimiter;
        this.csrfTokens = csrfTokens;
        this.auditLogService = auditLogService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return properties.getExcludedPaths().contains(path(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String path = path(req);
        String ip = req.getRemoteAddr();
        applySecurityHeaders(res);
        MDC.put(AuditLogService.MDC_CLIENT_IP, ip);
        try {
            if (!ipAccessList.isAllowed(ip)) {
                reject(req, res, null, AuditEntry.EventType.IP_BLOCKED, SecurityCoreException.Code.IP_BLOCKED,
                        Map.of("reason", "ip_denied"), false);
                return;
            }

            Session session = null;
            String sessionId = req.getHeader(SESSION_HEADER);
            if (sessionId != null && !sessionId.isBlank()) {
                try {
                    session = sessionService.validateSession(sessionId, ip, req.getHeader(HttpHeaders.USER_AGENT));
                } catch (SessionAnomalyException ex) {
                    // already audited by the session service
                    ipAccessList.recordViolation(ip);
                    writeError(res, SecurityCoreException.Code.SESSION_ANOMALY);
                    return;
                } catch (SessionExpiredException ex) {
                    if (ex.isUnknown()) {
                        reject(req, res, null, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT,
                                SecurityCoreException.Code.SESSION_EXPIRED, Map.of("reason", "unknown_session"), false);
                    } else {
                        writeError(res, SecurityCoreException.Code.SESSION_EXPIRED);
                    }
                    return;
                } catch (SecurityCoreException ex) {
                    if (ex.getCode() != SecurityCoreException.Code.AUDIT_UNAVAILABLE) {
                        throw ex;
                    }
                    log.error("Could not audit session refusal for {} {} from {}", req.getMethod(), path, ip, ex);
                    writeError(res, SecurityCoreException.Code.AUDIT_UNAVAILABLE);
                    return;
                }
                req.setAttribute(SESSION_ATTRIBUTE, session);
                MDC.put(AuditLogService.MDC_USER_ID, session.getUserId());
            }

            RateLimiterService.Tier tier = tierOf(path, session);
            String identity = tier == RateLimiterService.Tier.AUTHENTICATED ? session.userKey() : ip;
            if (properties.getRateLimit().isEnabled()) {
                res.setHeader("X-RateLimit-Limit", String.valueOf(rateLimiter.limitsFor(tier).getCapacity()));
                try {
                    RateLimiterService.Decision decision = rateLimiter.acquire(tier, identity);
                    res.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
                } catch (RateLimitExceededException ex) {
                    res.setHeader("X-RateLimit-Remaining", "0");
                    res.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
                    reject(req, res, session, AuditEntry.EventType.RATE_LIMIT_EXCEEDED,
                            SecurityCoreException.Code.RATE_LIMIT_EXCEEDED, Map.of("tier", tier.name()), true);
                    return;
                }
            }

            if (requiresSession(req, path) && session == null) {
                reject(req, res, null, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT,
                        SecurityCoreException.Code.AUTHENTICATION_REQUIRED, Map.of("reason", "no_session"), false);
                return;
            }

            if (csrfRequired(req, path) && !csrfValid(req, session)) {
                reject(req, res, session, AuditEntry.EventType.CSRF_VIOLATION,
                        SecurityCoreException.Code.CSRF_VIOLATION, Map.of(), true);
                return;
            }

            // Public paths and preflight requests carry no identity to authorise.
            if (session == null) {
                chain.doFilter(req, res);
                return;
            }

            if (path.startsWith(properties.getAdminPathPrefix()) && !session.hasRole(properties.getAdminRole())) {
                reject(req, res, session, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT,
                        SecurityCoreException.Code.ACCESS_DENIED, Map.of("reason", "missing_role"), true);
                return;
            }

            String pathTenant = tenantOf(path);
            if (pathTenant != null && !pathTenant.equals(session.getTenantId())) {
                reject(req, res, session, AuditEntry.EventType.UNAUTHORIZED_ACCESS_ATTEMPT,
                        SecurityCoreException.Code.ACCESS_DENIED, Map.of("reason", "cross_tenant"), true);
                return;
            }

            chain.doFilter(req, res);
        } finally {
            MDC.remove(AuditLogService.MDC_CLIENT_IP);
            MDC.remove(AuditLogService.MDC_USER_ID);
        }
    }

    private void reject(HttpServletRequest req, HttpServletResponse res, Session session,
                        AuditEntry.EventType type, SecurityCoreException.Code code,
                        Map<String, Object> details, boolean countViolation) throws IOException {
        String ip = req.getRemoteAddr();
        Map<String, Object> payload = new HashMap<>(details);
        payload.put("path", path(req));
        payload.put("method", req.getMethod());
        payload.put("code", code.name());
        log.warn("Rejecting {} {} from {}: {}", req.getMethod(), path(req), ip, code);
        try {
            auditLogService.logSecurityEvent(session == null ? null : session.getTenantId(), type, null,
                    session == null ? null : session.getUserId(), ip, payload);
            if (countViolation && ipAccessList.recordViolation(ip)) {
                auditLogService.logSecurityEvent(null, AuditEntry.EventType.IP_BLOCKED, null, null, ip,
                        Map.of("reason", "violation_threshold", "violations", ipAccessList.violationCount(ip)));
            }
        } catch (SecurityCoreException ex) {
            log.error("Could not audit rejection of {} {} from {}", req.getMethod(), path(req), ip, ex);
            writeError(res, SecurityCoreException.Code.AUDIT_UNAVAILABLE);
            return;
        }
        writeError(res, code);
    }

    private void writeError(HttpServletResponse res, SecurityCoreException.Code code) throws IOException {
        HttpStatus status = ApiExceptionHandler.statusOf(code);
        res.setStatus(status.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(res.getOutputStream(), ApiExceptionHandler.body(code.name()));
    }

    private void applySecurityHeaders(HttpServletResponse res) {
        MiddlewareProperties.Headers h = properties.getHeaders();
        res.setHeader("Strict-Transport-Security", h.getStrictTransportSecurity());
        res.setHeader("Content-Security-Policy", h.getContentSecurityPolicy());
        res.setHeader("X-Frame-Options", "DENY");
        res.setHeader("X-Content-Type-Options", "nosniff");
        res.setHeader("X-XSS-Protection", "1; mode=block");
        res.setHeader("Referrer-Policy", h.getReferrerPolicy());
        res.setHeader("Permissions-Policy", h.getPermissionsPolicy());
        res.setHeader(HttpHeaders.CACHE_CONTROL, "no-store, no-cache, must-revalidate");
        res.setHeader(HttpHeaders.PRAGMA, "no-cache");
    }

    private RateLimiterService.Tier tierOf(String path, Session session) {
        if (path.endsWith("/login")) {
            return RateLimiterService.Tier.LOGIN;
        }
        return session != null ? RateLimiterService.Tier.AUTHENTICATED : RateLimiterService.Tier.ANONYMOUS;
    }

    private boolean requiresSession(HttpServletRequest req, String path) {
        return !properties.getPublicPaths().contains(path) && !"OPTIONS".equals(req.getMethod());
    }

    private boolean csrfRequired(HttpServletRequest req, String path) {
        if (!properties.getCsrf().isEnabled() || !STATE_CHANGING.contains(req.getMethod())) {
            return false;
        }
        String authorization = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith("Bearer ")) {
            return false;
        }
        return !isCsrfExempt(path);
    }

    private boolean csrfValid(HttpServletRequest req, Session session) {
        if (session == null) {
            return false;
        }
        String token = req.getHeader(properties.getCsrf().getHeaderName());
        if (token == null && req.getCookies() != null) {
            for (Cookie cookie : req.getCookies()) {
                if (properties.getCsrf().getCookieName().equals(cookie.getName())) {
                    token = cookie.getValue();
                }
            }
        }
        return csrfTokens.isValid(session.getSessionId(), token);
    }

    private boolean isCsrfExempt(String path) {
        return properties.getCsrf().getExemptPaths().contains(path);
    }

    // "/tenants/{id}/..." -> id
    private static String tenantOf(String path) {
        if (!path.startsWith(TENANT_PREFIX)) {
            return null;
        }
        String rest = path.substring(TENANT_PREFIX.length());
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }

    private static String path(HttpServletRequest req) {
        String uri = req.getRequestURI();
        String context = req.getContextPath();
        return context != null && !context.isEmpty() && uri.startsWith(context) ? uri.substring(context.length()) : uri;
    }
}
