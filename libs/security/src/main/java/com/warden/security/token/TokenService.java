package com.warden.security.token;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.mfa.MfaClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies user access/refresh token pairs.
 * <p>
 * Verification is a pure function of the token, the signing keys and the clock; the service
 * keeps no per-token state.
 */
public final class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private final JwtCodec codec;
    private final TokenSettings settings;

    public TokenService(JwtCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec must not be null");
        }
        this.codec = codec;
        this.settings = codec.settings();
    }

    public TokenPair issueTokenPair(TokenRequest request) {
        return issueTokenPair(request, null);
    }

    /**
     * Issues an access token and a longer-lived refresh token for the same subject.
     *
     * @param mfa claims of a completed MFA challenge to embed, nullable
     */
    public TokenPair issueTokenPair(TokenRequest request, MfaClaims mfa) {
        Instant now = codec.clock().instant();
        TokenClaims access = userClaims(request, TokenType.ACCESS, now, now.plus(settings.accessTokenTtl()), mfa);
        TokenClaims refresh = userClaims(request, TokenType.REFRESH, now, now.plus(settings.refreshTokenTtl()), mfa);
        log.debug("Issued token pair for subject '{}' (access jti={})", request.subject(), access.tokenId());
        return new TokenPair(codec.encode(access), codec.encode(refresh), access.expiresAt(), refresh.expiresAt());
    }

    public TokenClaims verifyAccessToken(String token) {
        return verify(token, TokenType.ACCESS);
    }

    public TokenClaims verifyRefreshToken(String token) {
        return verify(token, TokenType.REFRESH);
    }

    /**
     * Exchanges a valid refresh token for a new pair carrying the same subject, tenant, scopes,
     * roles and MFA claims.
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = verifyRefreshToken(refreshToken);
        TokenRequest request = new TokenRequest(claims.subject(), claims.tenantId(), claims.scopes(), claims.roles());
        return issueTokenPair(request, claims.mfa());
    }

    /**
     * Verifies a token and requires the given purpose.
     *
     * @throws AuthException INVALID_TOKEN_TYPE when the token is valid but of another type
     */
    public TokenClaims verify(String token, TokenType expected) {
        TokenClaims claims = codec.decode(token);
        if (claims.type() != expected) {
            throw new AuthException(AuthErrorKind.INVALID_TOKEN_TYPE,
                    "Expected %s token".formatted(expected.claimValue()));
        }
        return claims;
    }

    private TokenClaims userClaims(TokenRequest request, TokenType type, Instant issuedAt,
                                   Instant expiresAt, MfaClaims mfa) {
        return new TokenClaims(
                request.subject(),
                request.tenantId(),
                request.scopes(),
                request.roles(),
                issuedAt,
                expiresAt,
                UUID.randomUUID().toString(),
                settings.issuer(),
                settings.audience(),
                type,
                null,
                List.of(),
                null,
                mfa);
    }
}
