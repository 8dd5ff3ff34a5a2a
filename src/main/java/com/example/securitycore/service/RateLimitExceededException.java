package com.example.securitycore.service;

import lombok.Getter;

public class RateLimitExceededException extends SecurityCoreException {

    @Getter
    private final long retryAfterSeconds;

    private RateLimitExceededException(String message, long retryAfterSeconds) {
        super(Code.RATE_LIMIT_EXCEEDED, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RateLimitExceededException of(RateLimiterService.Tier tier, String key, long retryAfterSeconds) {
        return new RateLimitExceededException("Rate limit for tier " + tier + " exceeded by " + key,
                retryAfterSeconds);
    }
}
