package com.warden.security.edge;

import java.util.Optional;

/**
 * Finds the credentials a request carries.
 * <p>
 * The user token is looked up in a fixed order: the {@code Authorization: Bearer} header, then
 * the access-token cookie, then the custom token header. Clients depend on that order.
 */
public final class CredentialExtractor {

    static final String AUTHORIZATION = "Authorization";

    private final EdgeSettings settings;

    public CredentialExtractor(EdgeSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    public Optional<String> bearerToken(EdgeRequest request) {
        Optional<String> fromHeader = request.header(AUTHORIZATION).flatMap(BearerTokenExtractor::extract);
        if (fromHeader.isPresent()) {
            return fromHeader;
        }
        Optional<String> fromCookie = request.cookie(settings.accessTokenCookie()).map(String::strip);
        if (fromCookie.isPresent()) {
            return fromCookie;
        }
        return request.header(settings.tokenHeader()).map(String::strip);
    }

    public Optional<String> serviceToken(EdgeRequest request) {
        return request.header(settings.serviceTokenHeader()).map(String::strip);
    }

    public Optional<String> apiKey(EdgeRequest request) {
        return request.header(settings.apiKeyHeader()).map(String::strip);
    }

    public Optional<String> tenantId(EdgeRequest request) {
        return request.header(settings.tenantHeader()).map(String::strip);
    }
}
