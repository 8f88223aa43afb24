package com.warden.security.ratelimit;

import java.time.Instant;
import java.util.Optional;

/**
 * Fixed-window request counter.
 */
public interface RateLimitCounter {

    /**
     * Counts one request for {@code key} in the window containing {@code now}, unless the window
     * already holds {@code limit} requests. Check and increment are one atomic step: concurrent
     * callers can never push a window past its limit.
     */
    RateLimitDecision tryAcquire(String key, WindowType windowType, int limit, Instant now);

    Optional<RateLimitWindow> currentWindow(String key, WindowType windowType, Instant now);

    /**
     * Drops windows that ended before {@code cutoff}.
     *
     * @return number of windows dropped; counters with native expiry may return 0
     */
    int purgeBefore(Instant cutoff);
}
