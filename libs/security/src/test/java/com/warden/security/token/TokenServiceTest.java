package com.warden.security.token;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.mfa.MfaClaims;
import com.warden.security.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPairGenerator;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenService")
class TokenServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final String OTHER_SECRET = "fedcba9876543210fedcba9876543210";

    private MutableClock clock;
    private StaticSigningKeyProvider keys;
    private TokenService tokens;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        keys = new StaticSigningKeyProvider(SigningKey.hmac("k1", SECRET.getBytes(StandardCharsets.UTF_8)));
        tokens = new TokenService(new JwtCodec(keys, TokenSettings.defaults("warden", "platform"), clock));
    }

    private static TokenRequest request() {
        return new TokenRequest("u1", "t1", List.of("read:billing"), List.of("user"));
    }

    private static AuthErrorKind kindOf(Throwable e) {
        return ((AuthException) e).kind();
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("verified access claims equal the requested claims")
        void accessClaimsRoundTrip() {
            TokenPair pair = tokens.issueTokenPair(request());

            TokenClaims claims = tokens.verifyAccessToken(pair.accessToken());

            assertThat(claims.subject()).isEqualTo("u1");
            assertThat(claims.tenantId()).isEqualTo("t1");
            assertThat(claims.scopes()).containsExactly("read:billing");
            assertThat(claims.roles()).containsExactly("user");
            assertThat(claims.issuer()).isEqualTo("warden");
            assertThat(claims.audience()).isEqualTo("platform");
            assertThat(claims.type()).isEqualTo(TokenType.ACCESS);
            assertThat(claims.isService()).isFalse();
            assertThat(claims.tokenId()).isNotBlank();
            assertThat(claims.expiresAt()).isEqualTo(Instant.parse("2026-03-01T10:15:00Z"));
        }

        @Test
        @DisplayName("refresh token lives longer and has its own type")
        void refreshTokenIsDistinct() {
            TokenPair pair = tokens.issueTokenPair(request());

            TokenClaims refresh = tokens.verifyRefreshToken(pair.refreshToken());

            assertThat(refresh.type()).isEqualTo(TokenType.REFRESH);
            assertThat(pair.refreshTokenExpiresAt()).isAfter(pair.accessTokenExpiresAt());
            assertThat(pair.tokenType()).isEqualTo("Bearer");
        }

        @Test
        @DisplayName("tenant may be absent")
        void noTenant() {
            TokenPair pair = tokens.issueTokenPair(new TokenRequest("u1", null, null, null));

            TokenClaims claims = tokens.verifyAccessToken(pair.accessToken());

            assertThat(claims.tenantId()).isNull();
            assertThat(claims.scopes()).isEmpty();
        }

        @Test
        @DisplayName("MFA claims pass through and expose an age check")
        void mfaClaims() {
            MfaClaims mfa = MfaClaims.verified("totp", "device-1", clock.instant());
            TokenPair pair = tokens.issueTokenPair(request(), mfa);

            TokenClaims claims = tokens.verifyAccessToken(pair.accessToken());

            assertThat(claims.mfa()).isEqualTo(mfa);
            assertThat(claims.isMfaTokenValid(Duration.ofMinutes(5), clock)).isTrue();
            clock.advance(Duration.ofMinutes(6));
            assertThat(claims.isMfaTokenValid(Duration.ofMinutes(5), clock)).isFalse();
        }
    }

    @Nested
    @DisplayName("Verification failures")
    class Failures {

        @Test
        @DisplayName("access token cannot be used as refresh token")
        void accessAsRefresh() {
            TokenPair pair = tokens.issueTokenPair(request());

            assertThatThrownBy(() -> tokens.refresh(pair.accessToken()))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_TOKEN_TYPE));
            assertThatThrownBy(() -> tokens.verifyAccessToken(pair.refreshToken()))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_TOKEN_TYPE));
        }

        @Test
        @DisplayName("expired token fails with TOKEN_EXPIRED")
        void expired() {
            TokenPair pair = tokens.issueTokenPair(request());
            clock.advance(Duration.ofMinutes(16));

            assertThatThrownBy(() -> tokens.verifyAccessToken(pair.accessToken()))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.TOKEN_EXPIRED));
        }

        @Test
        @DisplayName("token re-signed with another key fails with INVALID_SIGNATURE")
        void reSigned() {
            var forger = new TokenService(new JwtCodec(
                    new StaticSigningKeyProvider(SigningKey.hmac("k1", OTHER_SECRET.getBytes(StandardCharsets.UTF_8))),
                    TokenSettings.defaults("warden", "platform"), clock));
            String forged = forger.issueTokenPair(new TokenRequest("u1", "t1", List.of("*"), List.of("super_admin")))
                    .accessToken();

            assertThatThrownBy(() -> tokens.verifyAccessToken(forged))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_SIGNATURE));
        }

        @Test
        @DisplayName("altered payload fails with INVALID_SIGNATURE")
        void alteredPayload() {
            String token = tokens.issueTokenPair(request()).accessToken();
            String[] parts = token.split("\\.");
            String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8)
                    .replace("\"user\"", "\"admin\"");
            String tampered = parts[0] + "."
                    + Base64.getUrlEncoder().withoutPadding().encodeToString(payload.getBytes(StandardCharsets.UTF_8))
                    + "." + parts[2];

            assertThatThrownBy(() -> tokens.verifyAccessToken(tampered))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_SIGNATURE));
        }

        @Test
        @DisplayName("unknown key ID fails with INVALID_SIGNATURE")
        void unknownKeyId() {
            var other = new TokenService(new JwtCodec(
                    new StaticSigningKeyProvider(SigningKey.hmac("k9", SECRET.getBytes(StandardCharsets.UTF_8))),
                    TokenSettings.defaults("warden", "platform"), clock));
            String token = other.issueTokenPair(request()).accessToken();

            assertThatThrownBy(() -> tokens.verifyAccessToken(token))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_SIGNATURE));
        }

        @Test
        @DisplayName("wrong audience and wrong issuer have distinct kinds")
        void wrongAudienceAndIssuer() {
            String otherAudience = new TokenService(new JwtCodec(keys,
                    TokenSettings.defaults("warden", "partner-portal"), clock))
                    .issueTokenPair(request()).accessToken();
            String otherIssuer = new TokenService(new JwtCodec(keys,
                    TokenSettings.defaults("someone-else", "platform"), clock))
                    .issueTokenPair(request()).accessToken();

            assertThatThrownBy(() -> tokens.verifyAccessToken(otherAudience))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_AUDIENCE));
            assertThatThrownBy(() -> tokens.verifyAccessToken(otherIssuer))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_ISSUER));
        }

        @Test
        @DisplayName("garbage and empty input fail with MALFORMED_TOKEN")
        void malformed() {
            assertThatThrownBy(() -> tokens.verifyAccessToken("not-a-jwt"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.MALFORMED_TOKEN));
            assertThatThrownBy(() -> tokens.verifyAccessToken(""))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.MALFORMED_TOKEN));
        }
    }

    @Nested
    @DisplayName("Refresh and key rotation")
    class RefreshAndRotation {

        @Test
        @DisplayName("refresh issues a new pair with the same identity")
        void refreshKeepsIdentity() {
            TokenPair first = tokens.issueTokenPair(request());
            clock.advance(Duration.ofMinutes(20));

            TokenPair second = tokens.refresh(first.refreshToken());
            TokenClaims claims = tokens.verifyAccessToken(second.accessToken());

            assertThat(claims.subject()).isEqualTo("u1");
            assertThat(claims.roles()).containsExactly("user");
            assertThat(second.accessTokenExpiresAt()).isAfter(first.accessTokenExpiresAt());
        }

        @Test
        @DisplayName("tokens signed before a rotation verify until the old key is retired")
        void rotationOverlap() {
            String beforeRotation = tokens.issueTokenPair(request()).accessToken();
            keys.rotate(SigningKey.hmac("k2", OTHER_SECRET.getBytes(StandardCharsets.UTF_8)));
            String afterRotation = tokens.issueTokenPair(request()).accessToken();

            assertThat(tokens.verifyAccessToken(beforeRotation).subject()).isEqualTo("u1");
            assertThat(tokens.verifyAccessToken(afterRotation).subject()).isEqualTo("u1");

            keys.retire("k1");
            assertThatThrownBy(() -> tokens.verifyAccessToken(beforeRotation))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_SIGNATURE));
            assertThatThrownBy(() -> keys.retire("k2")).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("RS256 keys sign and verify")
        void rsaKeys() throws Exception {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            var rsaTokens = new TokenService(new JwtCodec(
                    new StaticSigningKeyProvider(SigningKey.rsa("rsa-1", generator.generateKeyPair())),
                    TokenSettings.defaults("warden", "platform"), clock));

            String token = rsaTokens.issueTokenPair(request()).accessToken();

            assertThat(rsaTokens.verifyAccessToken(token).subject()).isEqualTo("u1");
        }
    }

    @Test
    @DisplayName("rejects HMAC secrets shorter than 32 bytes")
    void rejectsShortSecret() {
        assertThatThrownBy(() -> SigningKey.hmac("k", "short".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
