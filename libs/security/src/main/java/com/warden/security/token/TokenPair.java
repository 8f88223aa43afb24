package com.warden.security.token;

import java.time.Instant;

/**
 * Access and refresh token issued together on login or refresh.
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        Instant accessTokenExpiresAt,
        Instant refreshTokenExpiresAt
) {

    public String tokenType() {
        return "Bearer";
    }
}
