package com.warden.security.apikey;

import com.warden.security.ratelimit.WindowType;

import java.time.Duration;

/**
 * Tunables of the {@link ApiKeyEngine}.
 *
 * @param keyPrefix                 prefix of every raw key
 * @param keyBytes                  random bytes per key
 * @param defaultExpiry             lifetime when the request names none, nullable for no expiry
 * @param maxKeysPerUser            active keys a user may hold
 * @param requireScopeValidation    whether requested scopes must be granted to the creator
 * @param defaultRateLimitRequests  requests per window when the request names none
 * @param defaultRateLimitWindow    window when the request names none
 * @param requireHttpsByDefault     HTTPS policy when the request names none
 */
public record ApiKeySettings(
        String keyPrefix,
        int keyBytes,
        Duration defaultExpiry,
        int maxKeysPerUser,
        boolean requireScopeValidation,
        int defaultRateLimitRequests,
        WindowType defaultRateLimitWindow,
        boolean requireHttpsByDefault
) {

    public static final String DEFAULT_KEY_PREFIX = "wk_";

    public ApiKeySettings {
        if (keyPrefix == null) {
            keyPrefix = DEFAULT_KEY_PREFIX;
        }
        if (keyBytes < 16) {
            throw new IllegalArgumentException("keyBytes must be at least 16");
        }
        if (maxKeysPerUser <= 0) {
            throw new IllegalArgumentException("maxKeysPerUser must be positive");
        }
        if (defaultRateLimitRequests <= 0) {
            throw new IllegalArgumentException("defaultRateLimitRequests must be positive");
        }
        if (defaultRateLimitWindow == null) {
            defaultRateLimitWindow = WindowType.HOUR;
        }
    }

    public static ApiKeySettings defaults() {
        return new ApiKeySettings(DEFAULT_KEY_PREFIX, 32, Duration.ofDays(90), 10, true, 1000, WindowType.HOUR, true);
    }
}
