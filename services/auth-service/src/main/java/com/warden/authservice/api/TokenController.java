package com.warden.authservice.api;

import com.warden.security.AuthException;
import com.warden.security.token.TokenClaims;
import com.warden.security.token.TokenPair;
import com.warden.security.token.TokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Token refresh for clients and token introspection for services.
 */
@RestController
public class TokenController {

    private static final Logger log = LoggerFactory.getLogger(TokenController.class);

    private final TokenService tokens;

    public TokenController(TokenService tokens) {
        this.tokens = tokens;
    }

    /** Exchanges a refresh token for a new pair. The refresh token is its own credential. */
    @PostMapping("/api/v1/tokens/refresh")
    public TokenPair refresh(@Valid @RequestBody RefreshRequest request) {
        return tokens.refresh(request.refreshToken());
    }

    /**
     * Reports whether an access token is currently valid. An invalid token is a normal answer,
     * not an error.
     */
    @PostMapping("/internal/v1/tokens/introspect")
    public Introspection introspect(@Valid @RequestBody IntrospectRequest request) {
        try {
            TokenClaims claims = tokens.verifyAccessToken(request.token());
            return Introspection.active(claims);
        } catch (AuthException e) {
            log.debug("Introspected token is not active: {}", e.code());
            return Introspection.inactive(e.code());
        }
    }

    public record RefreshRequest(@NotBlank String refreshToken) {
    }

    public record IntrospectRequest(@NotBlank String token) {
    }

    /**
     * @param reason error code when inactive
     */
    public record Introspection(
            boolean active,
            String subject,
            String tenantId,
            List<String> scopes,
            List<String> roles,
            Instant expiresAt,
            String tokenId,
            boolean mfaVerified,
            String reason) {

        static Introspection active(TokenClaims claims) {
            boolean mfa = claims.mfa() != null && claims.mfa().verified();
            return new Introspection(true, claims.subject(), claims.tenantId(), claims.scopes(), claims.roles(),
                    claims.expiresAt(), claims.tokenId(), mfa, null);
        }

        static Introspection inactive(String reason) {
            return new Introspection(false, null, null, List.of(), List.of(), null, null, false, reason);
        }
    }
}
