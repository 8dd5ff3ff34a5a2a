package com.example.securitycore.service;

import com.example.securitycore.config.MiddlewareProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fixed-window request limits per (identity, tier). Each key owns a Bucket4j bucket that
 * refills completely once per window; idle buckets fall out of a bounded Caffeine cache.
 */
@Service
@Slf4j
public class RateLimiterService {

    public enum Tier {
        ANONYMOUS,
        AUTHENTICATED,
        LOGIN
    }

    public record Decision(boolean allowed, long remaining, long retryAfterSeconds) {
    }

    private final MiddlewareProperties.RateLimit properties;
    private final TimeMeter timeMeter;
    private final Cache<String, Bucket> buckets;

    public RateLimiterService(MiddlewareProperties middlewareProperties, Clock clock) {
        this.properties = middlewareProperties.getRateLimit();
        this.timeMeter = new ClockTimeMeter(clock);
        Duration longestWindow = maxWindow(properties);
        this.buckets = Caffeine.newBuilder()
                .maximumSize(properties.getMaxTrackedKeys())
                .expireAfterAccess(longestWindow.multipliedBy(2))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Consumes one request from the bucket of {@code identity} in {@code tier}.
     */
    public Decision tryAcquire(Tier tier, String identity) {
        String key = tier.name() + ":" + identity;
        Bucket bucket = buckets.get(key, k -> newBucket(tier));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            return new Decision(true, probe.getRemainingTokens(), 0);
        }
        long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill() + 999_999_999L));
        log.debug("Rate limit hit for {} (retry after {}s)", key, retryAfter);
        return new Decision(false, 0, retryAfter);
    }

    /**
     * Like {@link #tryAcquire} but throws when the limit is exhausted.
     *
     * @return the granted decision, carrying the tokens left in the window
     * @throws RateLimitExceededException with the seconds until the window refills
     */
    public Decision acquire(Tier tier, String identity) {
        Decision decision = tryAcquire(tier, identity);
        if (!decision.allowed()) {
            throw RateLimitExceededException.of(tier, identity, decision.retryAfterSeconds());
        }
        return decision;
    }

    public MiddlewareProperties.Tier limitsFor(Tier tier) {
        return switch (tier) {
            case ANONYMOUS -> properties.getAnonymous();
            case AUTHENTICATED -> properties.getAuthenticated();
            case LOGIN -> properties.getLogin();
        };
    }

    private Bucket newBucket(Tier tier) {
        MiddlewareProperties.Tier limits = limitsFor(tier);
        Bandwidth window = Bandwidth.classic(limits.getCapacity(),
                Refill.intervally(limits.getCapacity(), limits.getWindow()));
        return Bucket.builder()
                .addLimit(window)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private static Duration maxWindow(MiddlewareProperties.RateLimit p) {
        Duration max = p.getAnonymous().getWindow();
        if (p.getAuthenticated().getWindow().compareTo(max) > 0) {
            max = p.getAuthenticated().getWindow();
        }
        if (p.getLogin().getWindow().compareTo(max) > 0) {
            max = p.getLogin().getWindow();
        }
        return max;
    }

    /** Drives buckets from the injected clock so windows follow the same time source as everything else. */
    private static final class ClockTimeMeter implements TimeMeter {
        private final Clock clock;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            return TimeUnit.MILLISECONDS.toNanos(clock.millis());
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
