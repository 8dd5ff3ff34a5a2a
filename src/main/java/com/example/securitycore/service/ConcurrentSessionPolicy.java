package com.example.securitycore.service;

/**
 * What happens when a user who already holds the maximum number of sessions logs in again.
 */
public enum ConcurrentSessionPolicy {
    /** Drop the session that was used least recently and admit the new one. */
    EVICT_LEAST_RECENTLY_USED,
    /** Refuse the new session. */
    REJECT_NEW
}
