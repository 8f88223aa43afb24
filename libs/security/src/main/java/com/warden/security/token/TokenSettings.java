package com.warden.security.token;

import java.time.Duration;

/**
 * Issuer-side token policy.
 *
 * @param issuer          expected and emitted {@code iss}
 * @param audience        expected and emitted {@code aud}
 * @param accessTokenTtl  lifetime of access tokens
 * @param refreshTokenTtl lifetime of refresh tokens, longer than access tokens
 * @param serviceTokenTtl lifetime of service tokens
 * @param clockSkew       tolerance applied to time-based claims during verification
 */
public record TokenSettings(
        String issuer,
        String audience,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration serviceTokenTtl,
        Duration clockSkew
) {

    public TokenSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be null or blank");
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(15);
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = Duration.ofDays(7);
        }
        if (serviceTokenTtl == null) {
            serviceTokenTtl = Duration.ofMinutes(5);
        }
        if (clockSkew == null) {
            clockSkew = Duration.ofSeconds(30);
        }
        if (refreshTokenTtl.compareTo(accessTokenTtl) <= 0) {
            throw new IllegalArgumentException("refreshTokenTtl must be longer than accessTokenTtl");
        }
    }

    public static TokenSettings defaults(String issuer, String audience) {
        return new TokenSettings(issuer, audience, null, null, null, null);
    }
}
