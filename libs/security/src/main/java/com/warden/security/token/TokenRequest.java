package com.warden.security.token;

import java.util.List;

/**
 * What to put into a user token pair.
 */
public record TokenRequest(String subject, String tenantId, List<String> scopes, List<String> roles) {

    public TokenRequest {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
