package com.warden.security.ratelimit;

import com.warden.security.store.BoundedIncrement;
import com.warden.security.store.KeyValueClient;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link RateLimitCounter} shared by every instance through a {@link KeyValueClient}. The bounded
 * increment runs server-side; window keys expire one grace period after their window ends.
 */
public final class KeyValueRateLimitCounter implements RateLimitCounter {

    static final Duration EXPIRY_GRACE = Duration.ofMinutes(1);

    private final KeyValueClient client;
    private final String keyPrefix;

    public KeyValueRateLimitCounter(KeyValueClient client, String keyPrefix) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.client = client;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "warden" : keyPrefix;
    }

    @Override
    public RateLimitDecision tryAcquire(String key, WindowType windowType, int limit, Instant now) {
        Instant windowStart = windowType.windowStart(now);
        Duration ttl = Duration.between(now, windowStart.plus(windowType.length())).plus(EXPIRY_GRACE);
        BoundedIncrement result = client.incrementWithinLimit(windowKey(key, windowType, windowStart), limit, ttl);
        return new RateLimitDecision(result.accepted(), result.count(), limit, windowType, windowType.retryAfter(now));
    }

    @Override
    public Optional<RateLimitWindow> currentWindow(String key, WindowType windowType, Instant now) {
        Instant windowStart = windowType.windowStart(now);
        return client.get(windowKey(key, windowType, windowStart))
                .map(count -> new RateLimitWindow(key, windowStart, windowType, Long.parseLong(count), null));
    }

    @Override
    public int purgeBefore(Instant cutoff) {
        return 0;
    }

    String windowKey(String key, WindowType windowType, Instant windowStart) {
        return "%s:ratelimit:%s:%s:%d".formatted(keyPrefix, key, windowType.label(), windowStart.getEpochSecond());
    }
}
