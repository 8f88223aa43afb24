package com.warden.security.edge;

import com.warden.security.rbac.Permission;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One row of the sensitivity table: which requests it covers and what they must present.
 *
 * @param pathPattern       Ant-style glob over the request path
 * @param methodPattern     {@code *}, a method name, or a comma-separated list of method names
 * @param tier              authentication level
 * @param requiredScopes    scopes every one of which the caller must hold (sensitive/admin)
 * @param requiredRoles     roles every one of which the caller must hold, inheritance included
 * @param permission        RBAC grant the caller's roles must cover, nullable
 * @param serviceOperations operations an internal caller's service token must allow
 * @param requireMfa        whether a fresh MFA verification is required
 */
public record RouteRule(
        String pathPattern,
        String methodPattern,
        SensitivityTier tier,
        Set<String> requiredScopes,
        Set<String> requiredRoles,
        Permission permission,
        Set<String> serviceOperations,
        boolean requireMfa
) {

    private static final String ANY_METHOD = "*";

    public RouteRule {
        if (pathPattern == null || pathPattern.isBlank()) {
            throw new IllegalArgumentException("pathPattern must not be null or blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier must not be null");
        }
        methodPattern = methodPattern == null || methodPattern.isBlank()
                ? ANY_METHOD : methodPattern.strip().toUpperCase(Locale.ROOT);
        requiredScopes = requiredScopes == null ? Set.of() : Set.copyOf(requiredScopes);
        requiredRoles = requiredRoles == null ? Set.of() : requiredRoles.stream()
                .map(role -> role.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        serviceOperations = serviceOperations == null ? Set.of() : Set.copyOf(serviceOperations);
    }

    public static RouteRule of(String pathPattern, String methodPattern, SensitivityTier tier) {
        return new RouteRule(pathPattern, methodPattern, tier, null, null, null, null, false);
    }

    public RouteRule withScopes(String... scopes) {
        return new RouteRule(pathPattern, methodPattern, tier, Set.of(scopes), requiredRoles, permission,
                serviceOperations, requireMfa);
    }

    public RouteRule withRoles(String... roles) {
        return new RouteRule(pathPattern, methodPattern, tier, requiredScopes, Set.of(roles), permission,
                serviceOperations, requireMfa);
    }

    public RouteRule withPermission(String action, String resource) {
        return new RouteRule(pathPattern, methodPattern, tier, requiredScopes, requiredRoles,
                Permission.of(action, resource), serviceOperations, requireMfa);
    }

    public RouteRule withServiceOperations(String... operations) {
        return new RouteRule(pathPattern, methodPattern, tier, requiredScopes, requiredRoles, permission,
                Set.of(operations), requireMfa);
    }

    public RouteRule withMfa() {
        return new RouteRule(pathPattern, methodPattern, tier, requiredScopes, requiredRoles, permission,
                serviceOperations, true);
    }

    boolean matchesMethod(String method) {
        if (ANY_METHOD.equals(methodPattern)) {
            return true;
        }
        if (method == null) {
            return false;
        }
        String normalized = method.toUpperCase(Locale.ROOT);
        return Arrays.stream(methodPattern.split(","))
                .map(String::strip)
                .anyMatch(normalized::equals);
    }
}
