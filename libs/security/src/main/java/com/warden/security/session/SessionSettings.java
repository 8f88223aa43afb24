package com.warden.security.session;

import java.time.Duration;

/**
 * Tunables of the {@link SessionManager}.
 *
 * @param ttl                          lifetime of a new session
 * @param slidingExpiration            whether each lookup pushes expiry to {@code now + ttl}
 * @param maxSessionsPerUser           cap enforced on creation by evicting the oldest sessions
 * @param suspiciousActivityThreshold  security warnings after which a session is invalidated
 */
public record SessionSettings(
        Duration ttl,
        boolean slidingExpiration,
        int maxSessionsPerUser,
        int suspiciousActivityThreshold
) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(8);
    public static final int DEFAULT_MAX_SESSIONS_PER_USER = 5;
    public static final int DEFAULT_SUSPICIOUS_ACTIVITY_THRESHOLD = 3;

    public SessionSettings {
        if (ttl == null) {
            ttl = DEFAULT_TTL;
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxSessionsPerUser <= 0) {
            throw new IllegalArgumentException("maxSessionsPerUser must be positive");
        }
        if (suspiciousActivityThreshold <= 0) {
            throw new IllegalArgumentException("suspiciousActivityThreshold must be positive");
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_TTL, true, DEFAULT_MAX_SESSIONS_PER_USER,
                DEFAULT_SUSPICIOUS_ACTIVITY_THRESHOLD);
    }
}
