package com.warden.security.mfa;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a completed MFA challenge, embedded in access tokens as the {@code mfa_*} claims.
 *
 * @param verified  whether the challenge succeeded
 * @param method    factor used (totp, sms, email, ...)
 * @param deviceId  enrolled device that answered the challenge, nullable
 * @param timestamp when the challenge was completed, nullable
 */
public record MfaClaims(boolean verified, String method, String deviceId, Instant timestamp) {

    /** Default maximum age of an MFA verification for step-up checks. */
    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(1);

    public static MfaClaims verified(String method, String deviceId, Instant timestamp) {
        return new MfaClaims(true, method, deviceId, timestamp);
    }

    /**
     * True when the challenge succeeded no longer than {@code maxAge} ago. A missing timestamp
     * is never fresh.
     */
    public boolean isFresh(Duration maxAge, Clock clock) {
        if (!verified || timestamp == null) {
            return false;
        }
        Duration age = Duration.between(timestamp, clock.instant());
        return age.compareTo(maxAge) <= 0;
    }
}
