package com.warden.security.edge;

import com.warden.security.mfa.MfaClaims;

import java.time.Duration;

/**
 * Names and limits used by the edge.
 *
 * @param serviceName        this service's name; internal calls must carry tokens addressed to it
 * @param accessTokenCookie  cookie holding the access token
 * @param tokenHeader        custom header holding the access token
 * @param serviceTokenHeader header holding a service token
 * @param apiKeyHeader       header holding an API key
 * @param tenantHeader       header naming the tenant a request addresses
 * @param mfaMaxAge          how old an MFA verification may be on routes that require one
 */
public record EdgeSettings(
        String serviceName,
        String accessTokenCookie,
        String tokenHeader,
        String serviceTokenHeader,
        String apiKeyHeader,
        String tenantHeader,
        Duration mfaMaxAge
) {

    public static final String DEFAULT_ACCESS_TOKEN_COOKIE = "access_token";
    public static final String DEFAULT_TOKEN_HEADER = "X-Auth-Token";
    public static final String DEFAULT_SERVICE_TOKEN_HEADER = "X-Service-Token";
    public static final String DEFAULT_API_KEY_HEADER = "X-API-Key";
    public static final String DEFAULT_TENANT_HEADER = "X-Tenant-ID";

    public EdgeSettings {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        accessTokenCookie = orDefault(accessTokenCookie, DEFAULT_ACCESS_TOKEN_COOKIE);
        tokenHeader = orDefault(tokenHeader, DEFAULT_TOKEN_HEADER);
        serviceTokenHeader = orDefault(serviceTokenHeader, DEFAULT_SERVICE_TOKEN_HEADER);
        apiKeyHeader = orDefault(apiKeyHeader, DEFAULT_API_KEY_HEADER);
        tenantHeader = orDefault(tenantHeader, DEFAULT_TENANT_HEADER);
        if (mfaMaxAge == null) {
            mfaMaxAge = MfaClaims.DEFAULT_MAX_AGE;
        }
    }

    public static EdgeSettings forService(String serviceName) {
        return new EdgeSettings(serviceName, null, null, null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
