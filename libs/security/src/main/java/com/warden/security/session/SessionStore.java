package com.warden.security.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for sessions. Implementations must be thread-safe; the
 * {@link SessionManager} behaves the same over any of them.
 */
public interface SessionStore {

    Optional<Session> get(String sessionId);

    /** Inserts or replaces the session. */
    void store(Session session);

    boolean delete(String sessionId);

    /** Every stored session of the user, expired ones included. */
    List<Session> listByUser(String userId);

    /**
     * Removes sessions expired at {@code now}, one at a time.
     *
     * @return number removed; stores with native expiry may return 0
     */
    int cleanupExpired(Instant now);
}
