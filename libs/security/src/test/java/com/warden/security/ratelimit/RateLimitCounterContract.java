package com.warden.security.ratelimit;

import com.warden.security.RateLimitExceededException;
import com.warden.security.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link RateLimitCounter} must share.
 */
abstract class RateLimitCounterContract {

    protected MutableClock clock;
    protected RateLimitCounter counter;

    protected abstract RateLimitCounter createCounter(MutableClock clock);

    @BeforeEach
    void setUpCounter() {
        clock = MutableClock.at("2026-03-01T10:00:10Z");
        counter = createCounter(clock);
    }

    @Test
    @DisplayName("three per minute: the fourth fails, the next minute succeeds")
    void boundary() {
        for (int i = 1; i <= 3; i++) {
            RateLimitDecision decision = counter.tryAcquire("k1", WindowType.MINUTE, 3, clock.instant());
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.count()).isEqualTo(i);
        }
        RateLimitDecision fourth = counter.tryAcquire("k1", WindowType.MINUTE, 3, clock.instant());
        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.count()).isEqualTo(3);
        assertThat(fourth.remaining()).isZero();
        assertThat(fourth.retryAfter()).isEqualTo(Duration.ofSeconds(50));
        assertThatThrownBy(fourth::throwIfDenied)
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessage("Rate limit exceeded: 3 requests per minute");

        clock.set(Instant.parse("2026-03-01T10:01:00Z"));
        assertThat(counter.tryAcquire("k1", WindowType.MINUTE, 3, clock.instant()).allowed()).isTrue();
    }

    @Test
    @DisplayName("keys and window types are counted separately")
    void separateBuckets() {
        counter.tryAcquire("k1", WindowType.MINUTE, 1, clock.instant());

        assertThat(counter.tryAcquire("k2", WindowType.MINUTE, 1, clock.instant()).allowed()).isTrue();
        assertThat(counter.tryAcquire("k1", WindowType.HOUR, 1, clock.instant()).allowed()).isTrue();
        assertThat(counter.currentWindow("k1", WindowType.MINUTE, clock.instant()))
                .get()
                .satisfies(w -> assertThat(w.requestCount()).isEqualTo(1));
    }

    @Test
    @DisplayName("a missing window reads as empty")
    void missingWindow() {
        assertThat(counter.currentWindow("never", WindowType.DAY, clock.instant())).isEmpty();
    }

    @Test
    @DisplayName("concurrent callers never exceed the limit")
    void concurrentCallers() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            Callable<Boolean> attempt = () -> counter.tryAcquire("k1", WindowType.MINUTE, 50, clock.instant()).allowed();
            List<Future<Boolean>> results = pool.invokeAll(Collections.nCopies(500, attempt));
            long allowed = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    allowed++;
                }
            }
            assertThat(allowed).isEqualTo(50);
        } finally {
            pool.shutdownNow();
        }
    }
}
