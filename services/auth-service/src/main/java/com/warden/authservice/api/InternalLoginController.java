package com.warden.authservice.api;

import com.warden.authservice.infrastructure.web.EdgeAuthorityFilter;
import com.warden.observability.RequestContext;
import com.warden.security.mfa.MfaClaims;
import com.warden.security.rbac.RbacEngine;
import com.warden.security.session.Session;
import com.warden.security.session.SessionManager;
import com.warden.security.session.SessionRequest;
import com.warden.security.token.TokenPair;
import com.warden.security.token.TokenRequest;
import com.warden.security.token.TokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login on behalf of a user whose credentials were already checked by a trusted service (the
 * identity provider front end). Only reachable with a service token.
 *
 * <p>Issues a token pair and opens a session. Roles default to the user's directly assigned
 * roles; a completed MFA challenge is embedded in the access token.
 */
@RestController
@RequestMapping("/internal/v1")
public class InternalLoginController {

    private static final Logger log = LoggerFactory.getLogger(InternalLoginController.class);

    private final TokenService tokens;
    private final SessionManager sessions;
    private final RbacEngine rbac;

    public InternalLoginController(TokenService tokens, SessionManager sessions, RbacEngine rbac) {
        this.tokens = tokens;
        this.sessions = sessions;
        this.rbac = rbac;
    }

    @PostMapping("/login")
    @ResponseStatus(HttpStatus.CREATED)
    public LoginResponse login(
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @Valid @RequestBody LoginRequest request) {
        List<String> roles = request.roles() != null
                ? request.roles()
                : new ArrayList<>(rbac.getUserRoles(request.userId(), false));
        TokenRequest tokenRequest = new TokenRequest(request.userId(), request.tenantId(), request.scopes(), roles);
        TokenPair pair = request.mfa() == null
                ? tokens.issueTokenPair(tokenRequest)
                : tokens.issueTokenPair(tokenRequest, request.mfa().toClaims());

        RequestContext userContext = context.withPrincipal(request.userId(), request.tenantId());
        Session session = sessions.createSession(userContext, new SessionRequest(request.userId(),
                request.tenantId(), request.ipAddress(), request.userAgent(), request.metadata()));
        log.info("Login completed for user '{}' (session {})", request.userId(), session.sessionId());

        return new LoginResponse(session.sessionId(), pair.accessToken(), pair.refreshToken(), pair.tokenType(),
                pair.accessTokenExpiresAt(), pair.refreshTokenExpiresAt(), session.expiresAt());
    }

    /**
     * @param roles null to use the user's assigned roles
     * @param mfa   completed challenge, nullable
     */
    public record LoginRequest(
            @NotBlank String userId,
            String tenantId,
            List<String> scopes,
            List<String> roles,
            String ipAddress,
            String userAgent,
            Map<String, String> metadata,
            @Valid MfaVerification mfa) {
    }

    public record MfaVerification(@NotBlank String method, String deviceId, Instant verifiedAt) {

        MfaClaims toClaims() {
            return MfaClaims.verified(method, deviceId, verifiedAt != null ? verifiedAt : Instant.now());
        }
    }

    public record LoginResponse(
            String sessionId,
            String accessToken,
            String refreshToken,
            String tokenType,
            Instant accessTokenExpiresAt,
            Instant refreshTokenExpiresAt,
            Instant sessionExpiresAt) {
    }
}
