package com.warden.security.concurrent;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed pool of locks selected by key hash. Two keys may share a stripe; one key always maps to
 * the same lock, so work on one user is serialized without a lock per user.
 */
public final class StripedLocks {

    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] locks;

    public StripedLocks() {
        this(DEFAULT_STRIPES);
    }

    public StripedLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive");
        }
        this.locks = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String key) {
        int hash = key == null ? 0 : key.hashCode();
        // spread high bits like HashMap
        hash ^= (hash >>> 16);
        return locks[Math.floorMod(hash, locks.length)];
    }

    public int stripes() {
        return locks.length;
    }
}
