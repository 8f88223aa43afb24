package com.warden.security.apikey;

import com.warden.security.ratelimit.WindowType;

import java.time.Instant;
import java.util.List;

/**
 * Stored API key. Holds only the SHA-256 hash of the raw key and its display prefix.
 *
 * @param keyId             public identifier
 * @param keyHash           hex SHA-256 of the raw key
 * @param keyPrefix         first 8 characters of the raw key, for display
 * @param userId            owner
 * @param tenantId          owner's tenant, nullable
 * @param name              display name
 * @param description       nullable
 * @param scopes            granted scopes ({@code action:resource})
 * @param status            lifecycle state
 * @param rateLimitRequests requests allowed per window
 * @param rateLimitWindow   window granularity
 * @param allowedIps        addresses, CIDR blocks or {@code *}; empty allows any
 * @param requireHttps      whether plain HTTP requests are refused
 * @param createdAt         creation time
 * @param expiresAt         nullable for keys that never expire
 * @param lastUsed          last successful authentication, nullable
 * @param totalRequests     successful authentications
 * @param failedRequests    authentications rejected after the key was found, plus error responses
 * @param rotatedFrom       key this one replaced, nullable
 */
public record ApiKey(
        String keyId,
        String keyHash,
        String keyPrefix,
        String userId,
        String tenantId,
        String name,
        String description,
        List<String> scopes,
        ApiKeyStatus status,
        int rateLimitRequests,
        WindowType rateLimitWindow,
        List<String> allowedIps,
        boolean requireHttps,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsed,
        long totalRequests,
        long failedRequests,
        String rotatedFrom
) {

    public ApiKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be null or blank");
        }
        if (keyHash == null || keyHash.isBlank()) {
            throw new IllegalArgumentException("keyHash must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (rateLimitRequests <= 0) {
            throw new IllegalArgumentException("rateLimitRequests must be positive");
        }
        if (status == null || rateLimitWindow == null) {
            throw new IllegalArgumentException("status and rateLimitWindow must not be null");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        allowedIps = allowedIps == null ? List.of() : List.copyOf(allowedIps);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    ApiKey withStatus(ApiKeyStatus newStatus) {
        return new ApiKey(keyId, keyHash, keyPrefix, userId, tenantId, name, description, scopes, newStatus,
                rateLimitRequests, rateLimitWindow, allowedIps, requireHttps, createdAt, expiresAt, lastUsed,
                totalRequests, failedRequests, rotatedFrom);
    }

    ApiKey withSuccessfulUse(Instant now) {
        return new ApiKey(keyId, keyHash, keyPrefix, userId, tenantId, name, description, scopes, status,
                rateLimitRequests, rateLimitWindow, allowedIps, requireHttps, createdAt, expiresAt, now,
                totalRequests + 1, failedRequests, rotatedFrom);
    }

    ApiKey withFailedRequest() {
        return new ApiKey(keyId, keyHash, keyPrefix, userId, tenantId, name, description, scopes, status,
                rateLimitRequests, rateLimitWindow, allowedIps, requireHttps, createdAt, expiresAt, lastUsed,
                totalRequests, failedRequests + 1, rotatedFrom);
    }

    ApiKey withPolicy(String newName, String newDescription, List<String> newScopes, int newRateLimitRequests,
                      WindowType newRateLimitWindow, List<String> newAllowedIps, boolean newRequireHttps) {
        return new ApiKey(keyId, keyHash, keyPrefix, userId, tenantId, newName, newDescription, newScopes, status,
                newRateLimitRequests, newRateLimitWindow, newAllowedIps, newRequireHttps, createdAt, expiresAt,
                lastUsed, totalRequests, failedRequests, rotatedFrom);
    }

    @Override
    public String toString() {
        return "ApiKey[keyId=%s, keyPrefix=%s, userId=%s, status=%s]".formatted(keyId, keyPrefix, userId, status);
    }
}
