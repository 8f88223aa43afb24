package com.warden.security.edge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.warden.observability.RequestContext;
import com.warden.security.mfa.MfaClaims;
import com.warden.security.rbac.SystemRoles;

import java.util.Set;

/**
 * Outcome of a successful edge decision: who is calling, for which tenant, with what grants.
 * <p>
 * Immutable; serialized by {@link SecurityContextSerializer} to travel with the request to
 * downstream services.
 *
 * @param principalType how the caller was identified
 * @param subject       user ID, service name, or null when anonymous
 * @param tenantId      caller's tenant, nullable
 * @param roles         effective roles (inheritance already expanded)
 * @param scopes        scopes of the token or API key
 * @param credentialId  token ID or API key ID, nullable
 * @param mfa           MFA claims carried by the token, nullable
 * @param tier          tier of the route that was authorized
 * @param correlationId correlation ID of the request
 */
public record SecurityContext(
        PrincipalType principalType,
        String subject,
        String tenantId,
        Set<String> roles,
        Set<String> scopes,
        String credentialId,
        MfaClaims mfa,
        SensitivityTier tier,
        String correlationId
) {

    public SecurityContext {
        if (principalType == null) {
            throw new IllegalArgumentException("principalType must not be null");
        }
        if (principalType != PrincipalType.ANONYMOUS && (subject == null || subject.isBlank())) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public static SecurityContext anonymous(SensitivityTier tier, String correlationId) {
        return new SecurityContext(PrincipalType.ANONYMOUS, null, null, Set.of(), Set.of(), null, null,
                tier, correlationId);
    }

    @JsonIgnore
    public boolean isAnonymous() {
        return principalType == PrincipalType.ANONYMOUS;
    }

    @JsonIgnore
    public boolean isSuperAdmin() {
        return roles.contains(SystemRoles.SUPER_ADMIN);
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope) || scopes.contains("*");
    }

    /**
     * The request context enriched with this principal, for logging and downstream calls.
     */
    public RequestContext applyTo(RequestContext context) {
        return isAnonymous() ? context : context.withPrincipal(subject, tenantId);
    }
}
