package com.example.securitycore.config;

import com.example.securitycore.service.ConcurrentSessionPolicy;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "security.session")
@Data
@Validated
public class SessionProperties {

    private Duration idleTimeout = Duration.ofMinutes(30);
    private Duration absoluteTimeout = Duration.ofHours(8);
    @Min(1)
    private int maxConcurrentSessions = 3;
    private ConcurrentSessionPolicy concurrentSessionPolicy = ConcurrentSessionPolicy.EVICT_LEAST_RECENTLY_USED;

    /** Destroy a session presented from a different IP or user agent. */
    private boolean strictBinding = true;
}
