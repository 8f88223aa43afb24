package com.warden.security.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.store.KeyValueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SessionStore} over a networked {@link KeyValueClient}. Sessions are stored as JSON
 * under {@code <prefix>:session:<id>} with the backend's native expiry; a per-user set under
 * {@code <prefix>:user_sessions:<userId>} indexes them and is pruned lazily.
 */
public final class KeyValueSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(KeyValueSessionStore.class);

    /** Lifetime of the per-user index; refreshed on every store. */
    static final Duration USER_INDEX_TTL = Duration.ofDays(30);

    private final KeyValueClient client;
    private final String keyPrefix;
    private final Clock clock;
    private final ObjectMapper mapper;

    public KeyValueSessionStore(KeyValueClient client, String keyPrefix, Clock clock) {
        if (client == null || clock == null) {
            throw new IllegalArgumentException("client and clock must not be null");
        }
        this.client = client;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "warden" : keyPrefix;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return client.get(sessionKey(sessionId)).flatMap(json -> read(sessionId, json));
    }

    @Override
    public void store(Session session) {
        Duration ttl = Duration.between(clock.instant(), session.expiresAt());
        if (ttl.isNegative() || ttl.isZero()) {
            delete(session.sessionId());
            return;
        }
        client.set(sessionKey(session.sessionId()), write(session), ttl);
        client.addToSet(userKey(session.userId()), session.sessionId(), USER_INDEX_TTL);
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Optional<Session> existing = get(sessionId);
        boolean removed = client.delete(sessionKey(sessionId));
        existing.ifPresent(session -> client.removeFromSet(userKey(session.userId()), sessionId));
        return removed;
    }

    @Override
    public List<Session> listByUser(String userId) {
        List<Session> result = new ArrayList<>();
        for (String sessionId : client.members(userKey(userId))) {
            Optional<Session> session = get(sessionId);
            if (session.isPresent()) {
                result.add(session.get());
            } else {
                client.removeFromSet(userKey(userId), sessionId);
            }
        }
        return result;
    }

    /**
     * The backend expires session keys itself; stale index members are pruned by
     * {@link #listByUser(String)}.
     */
    @Override
    public int cleanupExpired(Instant now) {
        return 0;
    }

    String sessionKey(String sessionId) {
        return keyPrefix + ":session:" + sessionId;
    }

    String userKey(String userId) {
        return keyPrefix + ":user_sessions:" + userId;
    }

    private String write(Session session) {
        try {
            return mapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR, "Failed to serialize session", e);
        }
    }

    private Optional<Session> read(String sessionId, String json) {
        try {
            return Optional.of(mapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable session record {}: {}", sessionId, e.getOriginalMessage());
            client.delete(sessionKey(sessionId));
            return Optional.empty();
        }
    }
}
