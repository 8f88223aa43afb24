package com.warden.security.session;

import com.warden.observability.RequestContext;
import com.warden.observability.SecurityEvent;
import com.warden.observability.SecurityEventSink;
import com.warden.observability.SecurityEventType;
import com.warden.security.concurrent.StripedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, reads, extends and ends login sessions over a pluggable {@link SessionStore}.
 * <p>
 * Work on one user's sessions (touching on read, cap eviction on create, security validation)
 * runs under that user's stripe of {@link StripedLocks}, so a concurrent eviction never removes
 * a session another request just created. The expiry sweep takes no user lock.
 * <p>
 * Expired sessions are detected lazily: a lookup that finds one removes it and reports nothing.
 */
public final class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private static final Comparator<Session> OLDEST_FIRST =
            Comparator.comparing(Session::createdAt).thenComparing(Session::sessionId);

    private final SessionStore store;
    private final SessionSettings settings;
    private final Clock clock;
    private final SecurityEventSink events;
    private final StripedLocks locks = new StripedLocks();

    public SessionManager(SessionStore store, SessionSettings settings, Clock clock, SecurityEventSink events) {
        if (store == null || settings == null || clock == null) {
            throw new IllegalArgumentException("store, settings and clock must not be null");
        }
        this.store = store;
        this.settings = settings;
        this.clock = clock;
        this.events = events == null ? SecurityEventSink.NOOP : events;
        log.info("Session manager initialized (ttl={}, sliding={}, maxSessionsPerUser={})",
                settings.ttl(), settings.slidingExpiration(), settings.maxSessionsPerUser());
    }

    /**
     * Creates a session, first evicting the user's oldest sessions by creation time so that at
     * most {@code maxSessionsPerUser} remain afterwards.
     */
    public Session createSession(RequestContext context, SessionRequest request) {
        return locks.withLock(request.userId(), () -> {
            Instant now = clock.instant();
            List<Session> existing = store.listByUser(request.userId()).stream()
                    .filter(s -> s.isUsable(now))
                    .sorted(OLDEST_FIRST)
                    .toList();
            int excess = existing.size() - settings.maxSessionsPerUser() + 1;
            for (int i = 0; i < excess; i++) {
                Session evicted = existing.get(i);
                store.delete(evicted.sessionId());
                publish(SecurityEventType.SESSION_INVALIDATED, context, evicted, "session_limit_exceeded");
            }
            if (excess > 0) {
                log.info("Evicted {} oldest session(s) of user '{}' to stay within {}",
                        excess, request.userId(), settings.maxSessionsPerUser());
            }

            Session session = new Session(
                    UUID.randomUUID().toString(),
                    request.userId(),
                    request.tenantId(),
                    now,
                    now,
                    now.plus(settings.ttl()),
                    SessionStatus.ACTIVE,
                    request.ipAddress(),
                    request.userAgent(),
                    request.metadata(),
                    List.of());
            store.store(session);
            log.info("Created session {} for user '{}' (tenant: {})",
                    session.sessionId(), session.userId(), session.tenantId());
            publish(SecurityEventType.SESSION_CREATED, context, session, null);
            return session;
        });
    }

    /**
     * Returns the live session and records the access. With sliding expiration the expiry moves
     * to {@code now + ttl} but never earlier than it already was.
     */
    public Optional<Session> getSession(RequestContext context, String sessionId) {
        Optional<Session> found = store.get(sessionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        return locks.withLock(found.get().userId(), () -> {
            Optional<Session> live = liveSession(context, sessionId);
            if (live.isEmpty()) {
                return live;
            }
            Session current = live.get();
            Instant now = clock.instant();
            Instant expiresAt = current.expiresAt();
            if (settings.slidingExpiration()) {
                Instant slid = now.plus(settings.ttl());
                if (slid.isAfter(expiresAt)) {
                    expiresAt = slid;
                }
            }
            Session touched = current.touched(now, expiresAt);
            store.store(touched);
            return Optional.of(touched);
        });
    }

    public boolean invalidateSession(RequestContext context, String sessionId) {
        Optional<Session> found = store.get(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        return locks.withLock(found.get().userId(), () -> end(context, found.get(), "logout"));
    }

    /**
     * Logs the user out everywhere, optionally keeping the current session.
     *
     * @return number of sessions invalidated
     */
    public int invalidateUserSessions(RequestContext context, String userId, String excludeSessionId) {
        int count = locks.withLock(userId, () -> {
            int ended = 0;
            for (Session session : store.listByUser(userId)) {
                if (!session.sessionId().equals(excludeSessionId) && end(context, session, "logout_all")) {
                    ended++;
                }
            }
            return ended;
        });
        log.info("Invalidated {} session(s) of user '{}'", count, userId);
        return count;
    }

    /**
     * Pushes the expiry of a live session out by {@code additionalTtl}, or by the configured
     * ttl when null.
     */
    public Optional<Session> extendSession(RequestContext context, String sessionId, Duration additionalTtl) {
        Duration extension = additionalTtl == null ? settings.ttl() : additionalTtl;
        if (extension.isNegative() || extension.isZero()) {
            throw new IllegalArgumentException("additionalTtl must be positive");
        }
        Optional<Session> found = store.get(sessionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        return locks.withLock(found.get().userId(), () -> liveSession(context, sessionId).map(session -> {
            Session extended = session.withExpiresAt(session.expiresAt().plus(extension));
            store.store(extended);
            log.info("Extended session {} until {}", sessionId, extended.expiresAt());
            return extended;
        }));
    }

    /**
     * Usable sessions of the user, oldest first.
     */
    public List<Session> listUserSessions(String userId) {
        Instant now = clock.instant();
        return store.listByUser(userId).stream()
                .filter(s -> s.isUsable(now))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    /**
     * Removes expired sessions. Meant for a periodic task off the request path.
     */
    public int cleanupExpiredSessions() {
        int removed = store.cleanupExpired(clock.instant());
        if (removed > 0) {
            log.info("Cleaned up {} expired session(s)", removed);
        }
        return removed;
    }

    /**
     * Compares the client's current address and user agent with those recorded at login. Each
     * mismatch is recorded as a warning and marks the session {@link SessionStatus#SUSPICIOUS};
     * once the warnings reach the configured threshold the session is invalidated.
     *
     * @return false when the session is missing, expired or has just been invalidated
     */
    public boolean validateSessionSecurity(RequestContext context, String sessionId,
                                           String ipAddress, String userAgent) {
        Optional<Session> found = store.get(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        return locks.withLock(found.get().userId(), () -> {
            Optional<Session> live = liveSession(context, sessionId);
            if (live.isEmpty()) {
                return false;
            }
            Session session = live.get();
            Instant now = clock.instant();
            boolean changed = false;
            if (session.ipAddress() != null && !Objects.equals(session.ipAddress(), ipAddress)) {
                log.warn("IP address mismatch for session {}", sessionId);
                session = session.withWarning(new SessionWarning(SessionWarning.IP_MISMATCH, now,
                        session.ipAddress(), ipAddress));
                changed = true;
            }
            if (session.userAgent() != null && !Objects.equals(session.userAgent(), userAgent)) {
                log.warn("User agent mismatch for session {}", sessionId);
                session = session.withWarning(new SessionWarning(SessionWarning.USER_AGENT_MISMATCH, now,
                        session.userAgent(), userAgent));
                changed = true;
            }
            if (!changed) {
                return true;
            }
            if (session.warningCount() >= settings.suspiciousActivityThreshold()) {
                end(context, session, "security_violation");
                return false;
            }
            Session suspicious = session.withStatus(SessionStatus.SUSPICIOUS);
            store.store(suspicious);
            publish(SecurityEventType.SESSION_SUSPICIOUS, context, suspicious, null);
            return true;
        });
    }

    private Optional<Session> liveSession(RequestContext context, String sessionId) {
        Optional<Session> current = store.get(sessionId);
        if (current.isEmpty()) {
            return current;
        }
        Session session = current.get();
        if (!session.isUsable(clock.instant())) {
            store.delete(sessionId);
            log.debug("Session {} expired", sessionId);
            publish(SecurityEventType.SESSION_EXPIRED, context, session.withStatus(SessionStatus.EXPIRED), null);
            return Optional.empty();
        }
        return current;
    }

    private boolean end(RequestContext context, Session session, String reason) {
        boolean removed = store.delete(session.sessionId());
        if (removed) {
            log.info("Invalidated session {} (reason: {})", session.sessionId(), reason);
            publish(SecurityEventType.SESSION_INVALIDATED, context,
                    session.withStatus(SessionStatus.INVALIDATED), reason);
        }
        return removed;
    }

    private void publish(SecurityEventType type, RequestContext context, Session session, String reason) {
        events.publish(SecurityEvent.of(type, context)
                .at(clock.instant())
                .subject(session.userId())
                .tenant(session.tenantId())
                .with("sessionId", session.sessionId())
                .with("status", session.status().name())
                .with("reason", reason)
                .build());
    }
}
