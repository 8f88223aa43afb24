package com.warden.security.token;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.mfa.MfaClaims;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;
import org.jose4j.jwx.JsonWebStructure;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Signs {@link TokenClaims} as compact JWS and verifies them back, mapping every failure to a
 * distinct {@link AuthErrorKind}.
 * <p>
 * Verification runs in two passes: the first only parses, so the {@code kid} header can pick the
 * verification key from the {@link SigningKeyProvider}; the second checks signature, issuer,
 * audience and time claims against that key.
 */
public final class JwtCodec {

    private static final Logger log = LoggerFactory.getLogger(JwtCodec.class);

    static final String CLAIM_TYPE = "type";
    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_SCOPES = "scopes";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_TARGET_SERVICE = "target_service";
    static final String CLAIM_ALLOWED_OPERATIONS = "allowed_operations";
    static final String CLAIM_IDENTITY_ID = "identity_id";
    static final String CLAIM_MFA_VERIFIED = "mfa_verified";
    static final String CLAIM_MFA_METHOD = "mfa_method";
    static final String CLAIM_MFA_DEVICE_ID = "mfa_device_id";
    static final String CLAIM_MFA_TIMESTAMP = "mfa_timestamp";

    private final SigningKeyProvider keys;
    private final TokenSettings settings;
    private final Clock clock;
    private final JwtConsumer parser = new JwtConsumerBuilder()
            .setSkipAllValidators()
            .setDisableRequireSignature()
            .setSkipSignatureVerification()
            .build();

    public JwtCodec(SigningKeyProvider keys, TokenSettings settings, Clock clock) {
        if (keys == null || settings == null || clock == null) {
            throw new IllegalArgumentException("keys, settings and clock must not be null");
        }
        this.keys = keys;
        this.settings = settings;
        this.clock = clock;
    }

    public TokenSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Signs the claims with the provider's current key.
     */
    public String encode(TokenClaims claims) {
        JwtClaims jwt = new JwtClaims();
        jwt.setSubject(claims.subject());
        jwt.setIssuer(claims.issuer());
        jwt.setAudience(claims.audience());
        jwt.setIssuedAt(NumericDate.fromMilliseconds(claims.issuedAt().toEpochMilli()));
        jwt.setExpirationTime(NumericDate.fromMilliseconds(claims.expiresAt().toEpochMilli()));
        jwt.setJwtId(claims.tokenId());
        jwt.setClaim(CLAIM_TYPE, claims.type().claimValue());
        if (claims.tenantId() != null) {
            jwt.setClaim(CLAIM_TENANT_ID, claims.tenantId());
        }
        if (claims.isService()) {
            jwt.setClaim(CLAIM_TARGET_SERVICE, claims.targetService());
            jwt.setStringListClaim(CLAIM_ALLOWED_OPERATIONS, claims.allowedOperations());
            jwt.setClaim(CLAIM_IDENTITY_ID, claims.identityId());
        } else {
            jwt.setStringListClaim(CLAIM_SCOPES, claims.scopes());
            jwt.setStringListClaim(CLAIM_ROLES, claims.roles());
        }
        MfaClaims mfa = claims.mfa();
        if (mfa != null) {
            jwt.setClaim(CLAIM_MFA_VERIFIED, mfa.verified());
            if (mfa.method() != null) {
                jwt.setClaim(CLAIM_MFA_METHOD, mfa.method());
            }
            if (mfa.deviceId() != null) {
                jwt.setClaim(CLAIM_MFA_DEVICE_ID, mfa.deviceId());
            }
            if (mfa.timestamp() != null) {
                jwt.setClaim(CLAIM_MFA_TIMESTAMP, mfa.timestamp().getEpochSecond());
            }
        }

        SigningKey key = keys.currentKey();
        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(jwt.toJson());
        jws.setKey(key.signingKey());
        jws.setKeyIdHeaderValue(key.keyId());
        jws.setAlgorithmHeaderValue(key.algorithm());
        jws.setHeader("typ", "JWT");
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR, "Token signing failed", e);
        }
    }

    /**
     * Verifies signature, issuer, audience and expiry and returns the claims. The token type is
     * not checked here.
     *
     * @throws AuthException MALFORMED_TOKEN, INVALID_SIGNATURE, TOKEN_EXPIRED, INVALID_AUDIENCE or
     *                       INVALID_ISSUER
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "Token is empty");
        }
        JwtContext context;
        try {
            context = parser.process(token);
        } catch (InvalidJwtException e) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "Token is malformed", e);
        }
        List<JsonWebStructure> structures = context.getJoseObjects();
        if (structures.isEmpty()) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "Token is malformed");
        }
        JsonWebStructure header = structures.get(0);
        SigningKey key = keys.keyById(header.getKeyIdHeaderValue())
                .orElseThrow(() -> new AuthException(AuthErrorKind.INVALID_SIGNATURE,
                        "Token signed with an unknown key"));
        if (!key.algorithm().equals(header.getAlgorithmHeaderValue())) {
            throw new AuthException(AuthErrorKind.INVALID_SIGNATURE, "Token signature algorithm not accepted");
        }

        JwtConsumer verifier = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setRequireSubject()
                .setRequireJwtId()
                .setExpectedIssuer(settings.issuer())
                .setExpectedAudience(settings.audience())
                .setAllowedClockSkewInSeconds((int) settings.clockSkew().toSeconds())
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setVerificationKey(key.verificationKey())
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, key.algorithm()))
                .build();
        try {
            verifier.processContext(context);
        } catch (InvalidJwtException e) {
            throw classify(e);
        }
        try {
            return toClaims(context.getJwtClaims());
        } catch (MalformedClaimException e) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "Token claims are malformed", e);
        }
    }

    private static AuthException classify(InvalidJwtException e) {
        AuthErrorKind kind;
        String message;
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            kind = AuthErrorKind.INVALID_SIGNATURE;
            message = "Token signature is invalid";
        } else if (e.hasExpired()) {
            kind = AuthErrorKind.TOKEN_EXPIRED;
            message = "Token has expired";
        } else if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            kind = AuthErrorKind.INVALID_AUDIENCE;
            message = "Token audience is not accepted";
        } else if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            kind = AuthErrorKind.INVALID_ISSUER;
            message = "Token issuer is not accepted";
        } else {
            kind = AuthErrorKind.MALFORMED_TOKEN;
            message = "Token is malformed";
        }
        log.debug("Token rejected as {}: {}", kind.code(), e.getMessage());
        return new AuthException(kind, message, e);
    }

    private static TokenClaims toClaims(JwtClaims jwt) throws MalformedClaimException {
        String typeValue = jwt.getStringClaimValue(CLAIM_TYPE);
        TokenType type = TokenType.fromClaim(typeValue)
                .orElseThrow(() -> new AuthException(AuthErrorKind.MALFORMED_TOKEN, "Unknown token type"));
        List<String> audience = jwt.hasAudience() ? jwt.getAudience() : List.of();
        MfaClaims mfa = null;
        if (jwt.hasClaim(CLAIM_MFA_VERIFIED)) {
            Boolean verified = jwt.getClaimValue(CLAIM_MFA_VERIFIED, Boolean.class);
            Number timestamp = jwt.getClaimValue(CLAIM_MFA_TIMESTAMP, Number.class);
            mfa = new MfaClaims(Boolean.TRUE.equals(verified),
                    jwt.getStringClaimValue(CLAIM_MFA_METHOD),
                    jwt.getStringClaimValue(CLAIM_MFA_DEVICE_ID),
                    timestamp == null ? null : Instant.ofEpochSecond(timestamp.longValue()));
        }
        return new TokenClaims(
                jwt.getSubject(),
                jwt.getStringClaimValue(CLAIM_TENANT_ID),
                listClaim(jwt, CLAIM_SCOPES),
                listClaim(jwt, CLAIM_ROLES),
                Instant.ofEpochMilli(jwt.getIssuedAt().getValueInMillis()),
                Instant.ofEpochMilli(jwt.getExpirationTime().getValueInMillis()),
                jwt.getJwtId(),
                jwt.getIssuer(),
                audience.isEmpty() ? null : audience.get(0),
                type,
                jwt.getStringClaimValue(CLAIM_TARGET_SERVICE),
                listClaim(jwt, CLAIM_ALLOWED_OPERATIONS),
                jwt.getStringClaimValue(CLAIM_IDENTITY_ID),
                mfa);
    }

    private static List<String> listClaim(JwtClaims jwt, String name) throws MalformedClaimException {
        return jwt.hasClaim(name) ? jwt.getStringListClaimValue(name) : List.of();
    }
}
