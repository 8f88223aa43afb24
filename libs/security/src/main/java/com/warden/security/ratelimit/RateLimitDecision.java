package com.warden.security.ratelimit;

import com.warden.security.RateLimitExceededException;

import java.time.Duration;

/**
 * Outcome of {@link RateLimitCounter#tryAcquire}.
 *
 * @param allowed    whether the request fits in the window
 * @param count      requests counted in the window after this call
 * @param limit      requests allowed per window
 * @param windowType window granularity
 * @param retryAfter time until the next window opens
 */
public record RateLimitDecision(boolean allowed, long count, int limit, WindowType windowType, Duration retryAfter) {

    public long remaining() {
        return Math.max(0L, limit - count);
    }

    /**
     * @throws RateLimitExceededException when the request was not allowed
     */
    public void throwIfDenied() {
        if (!allowed) {
            throw new RateLimitExceededException(windowType.label(), limit, retryAfter);
        }
    }
}
