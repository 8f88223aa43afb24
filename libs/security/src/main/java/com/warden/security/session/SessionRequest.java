package com.warden.security.session;

import java.util.Map;

/**
 * Login details for a new session.
 *
 * @param userId    owning user
 * @param tenantId  nullable
 * @param ipAddress client address, nullable
 * @param userAgent client user agent, nullable
 * @param metadata  extra attributes to keep on the session, nullable
 */
public record SessionRequest(String userId, String tenantId, String ipAddress, String userAgent,
                             Map<String, String> metadata) {

    public SessionRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SessionRequest of(String userId, String tenantId) {
        return new SessionRequest(userId, tenantId, null, null, null);
    }
}
