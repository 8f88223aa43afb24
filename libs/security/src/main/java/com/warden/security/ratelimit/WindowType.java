package com.warden.security.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Granularity of a fixed, calendar-aligned rate-limit window in UTC.
 * <p>
 * Windows start on the minute, hour or day boundary rather than sliding with the first request,
 * so a client can spend a full quota at the end of one window and again at the start of the
 * next.
 */
public enum WindowType {
    MINUTE(ChronoUnit.MINUTES),
    HOUR(ChronoUnit.HOURS),
    DAY(ChronoUnit.DAYS);

    private final ChronoUnit unit;

    WindowType(ChronoUnit unit) {
        this.unit = unit;
    }

    /** Start of the window containing {@code now}. */
    public Instant windowStart(Instant now) {
        return now.truncatedTo(unit);
    }

    public Instant nextWindowStart(Instant now) {
        return windowStart(now).plus(length());
    }

    /** Time from {@code now} until the next window opens. */
    public Duration retryAfter(Instant now) {
        return Duration.between(now, nextWindowStart(now));
    }

    public Duration length() {
        return unit.getDuration();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WindowType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("window must not be null or blank");
        }
        return valueOf(label.strip().toUpperCase(Locale.ROOT));
    }
}
