package com.warden.security.token;

import com.warden.security.mfa.MfaClaims;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Verified token payload. Immutable; the only channel through which authorization code learns a
 * caller's roles and scopes.
 *
 * @param subject           user ID, or the issuing service's name for service tokens
 * @param tenantId          caller's tenant, nullable
 * @param scopes            granted scopes ({@code action:resource})
 * @param roles             role names
 * @param issuedAt          {@code iat}
 * @param expiresAt         {@code exp}
 * @param tokenId           {@code jti}
 * @param issuer            {@code iss}
 * @param audience          {@code aud}
 * @param type              token purpose
 * @param targetService     service tokens only: the service the token is addressed to
 * @param allowedOperations service tokens only: operations the bearer may invoke
 * @param identityId        service tokens only: registration ID of the issuing service
 * @param mfa               MFA outcome embedded at issuance, nullable
 */
public record TokenClaims(
        String subject,
        String tenantId,
        List<String> scopes,
        List<String> roles,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId,
        String issuer,
        String audience,
        TokenType type,
        String targetService,
        List<String> allowedOperations,
        String identityId,
        MfaClaims mfa
) {

    public TokenClaims {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        roles = roles == null ? List.of() : List.copyOf(roles);
        allowedOperations = allowedOperations == null ? List.of() : List.copyOf(allowedOperations);
    }

    public boolean isService() {
        return type == TokenType.SERVICE;
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope) || scopes.contains("*");
    }

    /**
     * Whether this token carries an MFA verification no older than {@code maxAge}.
     */
    public boolean isMfaTokenValid(Duration maxAge, Clock clock) {
        return mfa != null && mfa.isFresh(maxAge, clock);
    }
}
