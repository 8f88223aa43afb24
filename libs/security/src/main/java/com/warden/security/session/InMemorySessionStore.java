package com.warden.security.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SessionStore}. Sessions are lost on restart and are not shared between
 * instances.
 */
public final class InMemorySessionStore implements SessionStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    @Override
    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void store(Session session) {
        // index inside compute so a concurrent unindex cannot drop the set we are adding to
        sessionsByUser.compute(session.userId(), (user, ids) -> {
            Set<String> indexed = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            indexed.add(session.sessionId());
            return indexed;
        });
        sessions.put(session.sessionId(), session);
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Session removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        unindex(removed);
        return true;
    }

    @Override
    public List<Session> listByUser(String userId) {
        Set<String> ids = sessionsByUser.get(userId);
        if (ids == null) {
            return List.of();
        }
        List<Session> result = new ArrayList<>();
        for (String id : ids) {
            Session session = sessions.get(id);
            if (session != null) {
                result.add(session);
            }
        }
        return result;
    }

    @Override
    public int cleanupExpired(Instant now) {
        int removed = 0;
        for (Session session : sessions.values()) {
            if (session.isExpired(now) && sessions.remove(session.sessionId(), session)) {
                unindex(session);
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    private void unindex(Session session) {
        sessionsByUser.computeIfPresent(session.userId(), (user, ids) -> {
            ids.remove(session.sessionId());
            return ids.isEmpty() ? null : ids;
        });
    }
}
