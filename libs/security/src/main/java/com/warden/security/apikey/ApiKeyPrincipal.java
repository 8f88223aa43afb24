package com.warden.security.apikey;

import java.util.List;

/**
 * Identity established by a successful API-key authentication.
 */
public record ApiKeyPrincipal(String keyId, String userId, String tenantId, List<String> scopes, String keyName) {

    public ApiKeyPrincipal {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
