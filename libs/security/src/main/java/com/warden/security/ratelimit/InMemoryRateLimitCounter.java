package com.warden.security.ratelimit;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RateLimitCounter}. Each window is updated inside
 * {@link ConcurrentHashMap#compute}, which makes the compare and the increment one step.
 */
public final class InMemoryRateLimitCounter implements RateLimitCounter {

    private record WindowKey(String key, WindowType windowType, Instant windowStart) {
    }

    private final Map<WindowKey, RateLimitWindow> windows = new ConcurrentHashMap<>();

    @Override
    public RateLimitDecision tryAcquire(String key, WindowType windowType, int limit, Instant now) {
        Instant windowStart = windowType.windowStart(now);
        WindowKey windowKey = new WindowKey(key, windowType, windowStart);
        boolean[] accepted = new boolean[1];
        RateLimitWindow window = windows.compute(windowKey, (k, existing) -> {
            RateLimitWindow current = existing == null ? RateLimitWindow.empty(key, windowType, windowStart) : existing;
            if (current.requestCount() >= limit) {
                accepted[0] = false;
                return current;
            }
            accepted[0] = true;
            return current.accept(now);
        });
        return new RateLimitDecision(accepted[0], window.requestCount(), limit, windowType, windowType.retryAfter(now));
    }

    @Override
    public Optional<RateLimitWindow> currentWindow(String key, WindowType windowType, Instant now) {
        return Optional.ofNullable(windows.get(new WindowKey(key, windowType, windowType.windowStart(now))));
    }

    @Override
    public int purgeBefore(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<WindowKey, RateLimitWindow> entry : windows.entrySet()) {
            WindowKey key = entry.getKey();
            Instant windowEnd = key.windowStart().plus(key.windowType().length());
            if (!windowEnd.isAfter(cutoff) && windows.remove(key, entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return windows.size();
    }
}
