package com.warden.security.apikey;

import com.warden.security.ratelimit.WindowType;

import java.time.Duration;
import java.util.List;

/**
 * Parameters of a new API key. Null policy fields take the engine's defaults.
 *
 * @param name              display name
 * @param description       nullable
 * @param scopes            requested scopes ({@code action:resource}), at least one
 * @param tenantId          nullable
 * @param expiresIn         lifetime, nullable for the default
 * @param rateLimitRequests nullable for the default
 * @param rateLimitWindow   nullable for the default
 * @param allowedIps        nullable for no restriction
 * @param requireHttps      nullable for the default
 */
public record ApiKeyRequest(
        String name,
        String description,
        List<String> scopes,
        String tenantId,
        Duration expiresIn,
        Integer rateLimitRequests,
        WindowType rateLimitWindow,
        List<String> allowedIps,
        Boolean requireHttps
) {

    public ApiKeyRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (scopes == null || scopes.isEmpty()) {
            throw new IllegalArgumentException("scopes must not be null or empty");
        }
        scopes = List.copyOf(scopes);
        allowedIps = allowedIps == null ? null : List.copyOf(allowedIps);
    }

    public static ApiKeyRequest of(String name, List<String> scopes) {
        return new ApiKeyRequest(name, null, scopes, null, null, null, null, null, null);
    }
}
