package com.example.securitycore.service;

import com.example.securitycore.config.MiddlewareProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Session-bound CSRF tokens. One live token per session; issuing a new one replaces the old.
 */
@Service
public class CsrfTokenService {

    private record IssuedToken(String value, long expiresAt) {
    }

    private final Clock clock;
    private final long ttlMillis;
    private final SecureRandom random = new SecureRandom();
    private final Cache<String, IssuedToken> tokensBySession;

    public CsrfTokenService(MiddlewareProperties properties, Clock clock) {
        this.clock = clock;
        this.ttlMillis = properties.getCsrf().getTokenTtl().toMillis();
        this.tokensBySession = Caffeine.newBuilder()
                .maximumSize(properties.getRateLimit().getMaxTrackedKeys())
                .expireAfterWrite(properties.getCsrf().getTokenTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    public String issue(String sessionId) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        tokensBySession.put(sessionId, new IssuedToken(token, clock.millis() + ttlMillis));
        return token;
    }

    public boolean isValid(String sessionId, String presented) {
        if (sessionId == null || presented == null) {
            return false;
        }
        IssuedToken issued = tokensBySession.getIfPresent(sessionId);
        if (issued == null || clock.millis() > issued.expiresAt()) {
            return false;
        }
        return MessageDigest.isEqual(
                issued.value().getBytes(StandardCharsets.US_ASCII),
                presented.getBytes(StandardCharsets.US_ASCII));
    }

    public void invalidate(String sessionId) {
        tokensBySession.invalidate(sessionId);
    }
}
