package com.warden.security.store;

import com.warden.security.BackendUnavailableException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal key-value contract used by the networked session store and rate-limit counter.
 * <p>
 * Every method may throw {@link BackendUnavailableException} when the store cannot be reached
 * within the configured timeouts.
 */
public interface KeyValueClient {

    Optional<String> get(String key);

    /**
     * Stores a value that the backend expires on its own after {@code ttl}.
     */
    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    void addToSet(String key, String member, Duration ttl);

    void removeFromSet(String key, String member);

    Set<String> members(String key);

    /**
     * Atomically increments the counter at {@code key} unless that would take it past
     * {@code limit}. A missing counter starts at zero and expires after {@code ttl}.
     */
    BoundedIncrement incrementWithinLimit(String key, long limit, Duration ttl);
}
