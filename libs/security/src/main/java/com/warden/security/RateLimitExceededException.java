package com.warden.security;

import java.time.Duration;

/**
 * Request rejected because the caller's window quota is used up.
 * <p>
 * Carries the window granularity, the limit and the time until the next window so clients can
 * back off. It never carries another caller's usage.
 */
public class RateLimitExceededException extends AuthException {

    private final String window;
    private final int limit;
    private final Duration retryAfter;

    public RateLimitExceededException(String window, int limit, Duration retryAfter) {
        super(AuthErrorKind.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded: %d requests per %s".formatted(limit, window));
        this.window = window;
        this.limit = limit;
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public String window() {
        return window;
    }

    public int limit() {
        return limit;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
