package com.warden.security.session;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Server-side login session. Immutable; the manager persists a new copy on every change.
 *
 * @param sessionId        unguessable identifier
 * @param userId           owning user
 * @param tenantId         owning tenant, nullable
 * @param createdAt        creation time, used for cap eviction
 * @param lastAccessed     last successful lookup
 * @param expiresAt        end of validity
 * @param status           lifecycle state
 * @param ipAddress        client address at login, nullable
 * @param userAgent        client user agent at login, nullable
 * @param metadata         free-form attributes supplied at login
 * @param securityWarnings observations recorded by security validation
 */
public record Session(
        String sessionId,
        String userId,
        String tenantId,
        Instant createdAt,
        Instant lastAccessed,
        Instant expiresAt,
        SessionStatus status,
        String ipAddress,
        String userAgent,
        Map<String, String> metadata,
        List<SessionWarning> securityWarnings
) {

    public Session {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("createdAt and expiresAt must not be null");
        }
        if (lastAccessed == null) {
            lastAccessed = createdAt;
        }
        if (status == null) {
            status = SessionStatus.ACTIVE;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        securityWarnings = securityWarnings == null ? List.of() : List.copyOf(securityWarnings);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Whether the session may still authenticate requests at {@code now}.
     */
    public boolean isUsable(Instant now) {
        return (status == SessionStatus.ACTIVE || status == SessionStatus.SUSPICIOUS) && !isExpired(now);
    }

    @JsonIgnore
    public int warningCount() {
        return securityWarnings.size();
    }

    public Session touched(Instant now, Instant newExpiresAt) {
        return new Session(sessionId, userId, tenantId, createdAt, now, newExpiresAt, status,
                ipAddress, userAgent, metadata, securityWarnings);
    }

    public Session withExpiresAt(Instant newExpiresAt) {
        return new Session(sessionId, userId, tenantId, createdAt, lastAccessed, newExpiresAt, status,
                ipAddress, userAgent, metadata, securityWarnings);
    }

    public Session withStatus(SessionStatus newStatus) {
        return new Session(sessionId, userId, tenantId, createdAt, lastAccessed, expiresAt, newStatus,
                ipAddress, userAgent, metadata, securityWarnings);
    }

    public Session withWarning(SessionWarning warning) {
        List<SessionWarning> warnings = new ArrayList<>(securityWarnings);
        warnings.add(warning);
        return new Session(sessionId, userId, tenantId, createdAt, lastAccessed, expiresAt, status,
                ipAddress, userAgent, metadata, warnings);
    }
}
