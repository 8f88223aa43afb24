package com.warden.security.ratelimit;

import java.time.Instant;

/**
 * Usage of one key within one window.
 *
 * @param key          rate-limited key (an API key ID)
 * @param windowStart  start of the window
 * @param windowType   window granularity
 * @param requestCount accepted requests so far; never exceeds the limit
 * @param lastRequest  time of the last accepted request, nullable
 */
public record RateLimitWindow(String key, Instant windowStart, WindowType windowType,
                              long requestCount, Instant lastRequest) {

    public static RateLimitWindow empty(String key, WindowType windowType, Instant windowStart) {
        return new RateLimitWindow(key, windowStart, windowType, 0L, null);
    }

    RateLimitWindow accept(Instant now) {
        return new RateLimitWindow(key, windowStart, windowType, requestCount + 1, now);
    }
}
