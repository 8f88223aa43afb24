package com.warden.security.apikey;

import com.warden.security.ratelimit.WindowType;

import java.util.List;

/**
 * Changes to an existing key's policy. Null fields are left unchanged.
 */
public record ApiKeyUpdate(
        String name,
        String description,
        List<String> scopes,
        Integer rateLimitRequests,
        WindowType rateLimitWindow,
        List<String> allowedIps,
        Boolean requireHttps
) {

    public ApiKeyUpdate {
        scopes = scopes == null ? null : List.copyOf(scopes);
        allowedIps = allowedIps == null ? null : List.copyOf(allowedIps);
    }
}
