package com.warden.security.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StripedLocks")
class StripedLocksTest {

    @Test
    @DisplayName("same key always maps to the same lock")
    void stableStripe() {
        StripedLocks locks = new StripedLocks(8);

        assertThat(locks.lockFor("u1")).isSameAs(locks.lockFor("u1"));
        assertThat(locks.lockFor(null)).isSameAs(locks.lockFor(null));
        assertThat(locks.stripes()).isEqualTo(8);
    }

    @Test
    @DisplayName("serializes work on one key")
    void serializes() throws Exception {
        StripedLocks locks = new StripedLocks();
        int[] counter = {0};
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 1000; i++) {
            pool.submit(() -> locks.withLock("u1", () -> counter[0]++));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(counter[0]).isEqualTo(1000);
    }

    @Test
    @DisplayName("releases the lock when the action throws")
    void releasesOnFailure() {
        StripedLocks locks = new StripedLocks(1);

        assertThatThrownBy(() -> locks.withLock("u1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.lockFor("u1").isLocked()).isFalse();
    }

    @Test
    @DisplayName("rejects a non-positive stripe count")
    void rejectsBadSize() {
        assertThatThrownBy(() -> new StripedLocks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
