package com.warden.security.edge;

import com.warden.observability.RequestContext;
import com.warden.observability.SecurityEvent;
import com.warden.observability.SecurityEventSink;
import com.warden.observability.SecurityEventType;
import com.warden.observability.SecurityMetrics;
import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.TenantMismatchException;
import com.warden.security.apikey.ApiKeyEngine;
import com.warden.security.apikey.ApiKeyPrincipal;
import com.warden.security.apikey.ApiRequestInfo;
import com.warden.security.mfa.MfaProvider;
import com.warden.security.mfa.NoOpMfaProvider;
import com.warden.security.rbac.Permission;
import com.warden.security.rbac.RbacEngine;
import com.warden.security.rbac.SystemRoles;
import com.warden.security.token.ServiceTokenService;
import com.warden.security.token.TokenClaims;
import com.warden.security.token.TokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Single entry point of request authorization. Picks the route's tier, establishes the caller's
 * identity through the token service, service-token service or API-key engine, and applies the
 * tenant, scope, role, permission and MFA checks the tier calls for.
 * <p>
 * Every denial is an {@link AuthException}; authorization failures carry the generic
 * "Access denied" message and the detail goes to the server log and the security event.
 */
public final class EdgeAuthority {

    private static final Logger log = LoggerFactory.getLogger(EdgeAuthority.class);

    private final TokenService tokens;
    private final ServiceTokenService serviceTokens;
    private final ApiKeyEngine apiKeys;
    private final RbacEngine rbac;
    private final SensitivityRouter router;
    private final CredentialExtractor credentials;
    private final EdgeSettings settings;
    private final MfaProvider mfa;
    private final Clock clock;
    private final SecurityEventSink events;
    private final SecurityMetrics metrics;

    private EdgeAuthority(Builder builder) {
        this.tokens = builder.tokens;
        this.serviceTokens = builder.serviceTokens;
        this.apiKeys = builder.apiKeys;
        this.rbac = builder.rbac;
        this.router = builder.router;
        this.settings = builder.settings;
        this.credentials = new CredentialExtractor(builder.settings);
        this.mfa = builder.mfa == null ? new NoOpMfaProvider() : builder.mfa;
        this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        this.events = builder.events == null ? SecurityEventSink.NOOP : builder.events;
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decides whether the request may proceed.
     *
     * @return the caller's security context; anonymous for public routes
     * @throws AuthException when the request is not authenticated or not allowed
     */
    public SecurityContext authorize(RequestContext context, EdgeRequest request) {
        RouteRule rule = router.resolve(request.method(), request.path());
        if (metrics == null) {
            return decide(context, request, rule);
        }
        return metrics.timeDecision(rule.tier().label(), () -> {
            try {
                SecurityContext decided = decide(context, request, rule);
                metrics.recordDecision(rule.tier().label(), true);
                return decided;
            } catch (AuthException e) {
                metrics.recordDecision(rule.tier().label(), false);
                throw e;
            }
        });
    }

    public SensitivityRouter router() {
        return router;
    }

    public CredentialExtractor credentials() {
        return credentials;
    }

    private SecurityContext decide(RequestContext context, EdgeRequest request, RouteRule rule) {
        return switch (rule.tier()) {
            case PUBLIC -> SecurityContext.anonymous(rule.tier(), context.correlationId());
            case INTERNAL -> authorizeService(context, request, rule);
            default -> authorizeCaller(context, request, rule);
        };
    }

    private SecurityContext authorizeCaller(RequestContext context, EdgeRequest request, RouteRule rule) {
        SecurityContext principal = authenticate(context, request, rule);
        enforceTenant(context, principal, credentials.tenantId(request).orElse(null));
        if (rule.tier().checksGrants()) {
            checkGrants(context, principal, rule);
        }
        log.debug("Authorized {} {} for {} '{}' ({})", request.method(), request.path(),
                principal.principalType(), principal.subject(), rule.tier().label());
        return principal;
    }

    private SecurityContext authorizeService(RequestContext context, EdgeRequest request, RouteRule rule) {
        String token = credentials.serviceToken(request)
                .orElseThrow(() -> reject(context, SecurityEventType.SERVICE_TOKEN_REJECTED,
                        AuthException.notAuthenticated("Service token required"), request, null));
        TokenClaims claims;
        try {
            claims = serviceTokens.verifyServiceToken(token, settings.serviceName(), rule.serviceOperations());
        } catch (AuthException e) {
            throw reject(context, SecurityEventType.SERVICE_TOKEN_REJECTED, e, request, null);
        }
        return new SecurityContext(PrincipalType.SERVICE, claims.subject(), claims.tenantId(), Set.of(),
                new LinkedHashSet<>(claims.allowedOperations()), claims.tokenId(), null, rule.tier(),
                context.correlationId());
    }

    private SecurityContext authenticate(RequestContext context, EdgeRequest request, RouteRule rule) {
        Optional<String> bearer = credentials.bearerToken(request);
        if (bearer.isPresent()) {
            TokenClaims claims;
            try {
                claims = tokens.verifyAccessToken(bearer.get());
            } catch (AuthException e) {
                throw reject(context, SecurityEventType.TOKEN_INVALID, e, request, null);
            }
            return new SecurityContext(PrincipalType.USER, claims.subject(), claims.tenantId(),
                    rbac.expandRoles(claims.roles()), new LinkedHashSet<>(claims.scopes()), claims.tokenId(),
                    claims.mfa(), rule.tier(), context.correlationId());
        }
        Optional<String> apiKey = credentials.apiKey(request);
        if (apiKey.isPresent() && apiKeys != null) {
            ApiKeyPrincipal principal = apiKeys.authenticate(context, apiKey.get(), new ApiRequestInfo(
                    request.remoteAddress(), request.secure(), request.header("User-Agent").orElse(null),
                    request.method(), request.path()));
            return new SecurityContext(PrincipalType.API_KEY, principal.userId(), principal.tenantId(), Set.of(),
                    new LinkedHashSet<>(principal.scopes()), principal.keyId(), null, rule.tier(),
                    context.correlationId());
        }
        throw reject(context, SecurityEventType.TOKEN_INVALID,
                AuthException.notAuthenticated("Authentication required"), request, null);
    }

    private void enforceTenant(RequestContext context, SecurityContext principal, String requestedTenant) {
        try {
            TenantIsolationEnforcer.enforce(principal, requestedTenant);
        } catch (TenantMismatchException e) {
            log.warn("Tenant mismatch for '{}': {}", principal.subject(), e.logDetail());
            events.publish(SecurityEvent.of(SecurityEventType.TENANT_MISMATCH, context)
                    .at(clock.instant())
                    .subject(principal.subject())
                    .tenant(principal.tenantId())
                    .with("requestedTenant", requestedTenant)
                    .build());
            throw e;
        }
    }

    private void checkGrants(RequestContext context, SecurityContext principal, RouteRule rule) {
        for (String scope : rule.requiredScopes()) {
            if (!principal.hasScope(scope)) {
                throw deny(context, principal, rule, AuthErrorKind.INSUFFICIENT_SCOPE, "missing scope " + scope);
            }
        }

        Set<String> roles = rule.requiredRoles();
        if (roles.isEmpty() && rule.tier() == SensitivityTier.ADMIN) {
            roles = Set.of(SystemRoles.ADMIN);
        }
        if (!RoleChecker.hasAllRoles(principal, roles)) {
            throw deny(context, principal, rule, AuthErrorKind.INSUFFICIENT_ROLE, "missing role in " + roles);
        }

        Permission permission = rule.permission();
        if (permission != null && !permits(principal, permission)) {
            AuthErrorKind kind = principal.principalType() == PrincipalType.API_KEY
                    ? AuthErrorKind.INSUFFICIENT_SCOPE : AuthErrorKind.INSUFFICIENT_ROLE;
            throw deny(context, principal, rule, kind, "missing permission " + permission.toScope());
        }

        if (rule.requireMfa() || mfa.isRequiredFor(principal.subject(), rule.requiredScopes())) {
            boolean fresh = principal.mfa() != null && principal.mfa().isFresh(settings.mfaMaxAge(), clock);
            if (!fresh) {
                throw deny(context, principal, rule, AuthErrorKind.MFA_REQUIRED, "fresh MFA required");
            }
        }
    }

    /**
     * User tokens are judged by the roles they carry. API keys must carry the permission as a
     * scope and their owner must still hold it.
     */
    private boolean permits(SecurityContext principal, Permission permission) {
        if (principal.principalType() == PrincipalType.API_KEY) {
            return principal.hasScope(permission.toScope())
                    && rbac.checkPermission(principal.subject(), permission.action(), permission.resource());
        }
        return rbac.hasPermission(principal.roles(), permission.action(), permission.resource());
    }

    private AuthException deny(RequestContext context, SecurityContext principal, RouteRule rule,
                               AuthErrorKind kind, String detail) {
        log.warn("Denied {} '{}' on {} ({}): {}", principal.principalType(), principal.subject(),
                rule.pathPattern(), rule.tier().label(), detail);
        events.publish(SecurityEvent.of(SecurityEventType.PERMISSION_DENIED, context)
                .at(clock.instant())
                .subject(principal.subject())
                .tenant(principal.tenantId())
                .with("kind", kind.code())
                .with("route", rule.pathPattern())
                .with("tier", rule.tier().label())
                .build());
        return AuthException.accessDenied(kind);
    }

    private AuthException reject(RequestContext context, SecurityEventType type, AuthException cause,
                                 EdgeRequest request, String subject) {
        log.warn("Rejected credential on {} {}: {}", request.method(), request.path(), cause.code());
        events.publish(SecurityEvent.of(type, context)
                .at(clock.instant())
                .subject(subject)
                .with("kind", cause.code())
                .with("path", request.path())
                .with("ipAddress", request.remoteAddress())
                .build());
        return cause;
    }

    public static final class Builder {

        private TokenService tokens;
        private ServiceTokenService serviceTokens;
        private ApiKeyEngine apiKeys;
        private RbacEngine rbac;
        private SensitivityRouter router;
        private EdgeSettings settings;
        private MfaProvider mfa;
        private Clock clock;
        private SecurityEventSink events;
        private SecurityMetrics metrics;

        private Builder() {
        }

        public Builder tokens(TokenService tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder serviceTokens(ServiceTokenService serviceTokens) {
            this.serviceTokens = serviceTokens;
            return this;
        }

        /** Optional; without it API keys are not accepted. */
        public Builder apiKeys(ApiKeyEngine apiKeys) {
            this.apiKeys = apiKeys;
            return this;
        }

        public Builder rbac(RbacEngine rbac) {
            this.rbac = rbac;
            return this;
        }

        public Builder router(SensitivityRouter router) {
            this.router = router;
            return this;
        }

        public Builder settings(EdgeSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder mfa(MfaProvider mfa) {
            this.mfa = mfa;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder events(SecurityEventSink events) {
            this.events = events;
            return this;
        }

        public Builder metrics(SecurityMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public EdgeAuthority build() {
            if (tokens == null || serviceTokens == null || rbac == null || router == null || settings == null) {
                throw new IllegalStateException("tokens, serviceTokens, rbac, router and settings are required");
            }
            return new EdgeAuthority(this);
        }
    }
}
