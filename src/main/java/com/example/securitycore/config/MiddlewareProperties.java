package com.example.securitycore.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Request-boundary settings bound from {@code security.middleware.*}.
 */
@Component
@ConfigurationProperties(prefix = "security.middleware")
@Data
public class MiddlewareProperties {

    /** Paths served without any middleware checks. */
    private List<String> excludedPaths = new ArrayList<>(List.of("/health"));

    /** Paths that go through the checks but need no session. */
    private List<String> publicPaths = new ArrayList<>(List.of("/sessions/login"));

    private String adminPathPrefix = "/admin/";
    private String adminRole = "security_admin";

    private IpFilter ip = new IpFilter();
    private RateLimit rateLimit = new RateLimit();
    private Csrf csrf = new Csrf();
    private Headers headers = new Headers();

    @Data
    public static class IpFilter {
        private List<String> denyList = new ArrayList<>();
        /** When non-empty only these addresses are let through. */
        private List<String> allowList = new ArrayList<>();
        private int autoBlockThreshold = 10;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private long maxTrackedKeys = 100_000;
        private Tier anonymous = new Tier(100, Duration.ofSeconds(60));
        private Tier authenticated = new Tier(1000, Duration.ofSeconds(60));
        private Tier login = new Tier(5, Duration.ofSeconds(300));
    }

    @Data
    public static class Tier {
        private long capacity;
        private Duration window;

        public Tier() {
        }

        public Tier(long capacity, Duration window) {
            this.capacity = capacity;
            this.window = window;
        }
    }

    @Data
    public static class Csrf {
        private boolean enabled = true;
        private Duration tokenTtl = Duration.ofHours(1);
        private String headerName = "X-CSRF-Token";
        private String cookieName = "csrf_token";
        private List<String> exemptPaths = new ArrayList<>(List.of("/sessions/login"));
    }

    @Data
    public static class Headers {
        private String strictTransportSecurity = "max-age=31536000; includeSubDomains; preload";
        private String contentSecurityPolicy = "default-src 'self'; script-src 'self'; style-src 'self'; "
                + "img-src 'self' data:; connect-src 'self'; frame-ancestors 'none'; "
                + "base-uri 'self'; form-action 'self'";
        private String permissionsPolicy = "geolocation=(), microphone=(), camera=(), payment=(), usb=()";
        private String referrerPolicy = "strict-origin-when-cross-origin";
    }
}
