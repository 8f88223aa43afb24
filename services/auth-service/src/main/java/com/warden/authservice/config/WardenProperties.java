package com.warden.authservice.config;

import com.warden.security.edge.RouteRule;
import com.warden.security.edge.SensitivityTier;
import com.warden.security.ratelimit.WindowType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the auth service, bound from {@code warden.auth.*}.
 *
 * <pre>
 * warden:
 *   auth:
 *     service-name: auth-service
 *     tokens:
 *       issuer: warden
 *       audience: platform
 *       current-key-id: k1
 *       signing-secrets:
 *         k1: ${WARDEN_SIGNING_SECRET}
 *     sessions:
 *       backend: redis
 *     redis:
 *       host: redis.internal
 * </pre>
 *
 * <p>Defaults are applied in the compact constructors, which run before Bean Validation.
 *
 * @param serviceName  this service's name; internal callers need tokens addressed to it
 * @param environment  deployment environment
 * @param tokens       token issuance and verification
 * @param sessions     session lifecycle and backend
 * @param apiKeys      API key policy and rate-limit backend
 * @param redis        connection used by every {@code redis} backend
 * @param edge         credential names and the sensitivity table
 * @param mfa          scopes that require a fresh MFA verification
 * @param services     service identities allowed to call other services
 * @param roleSeed     resource holding the initial roles and assignments, blank for none
 * @param maintenance  periodic cleanup
 */
@ConfigurationProperties(prefix = "warden.auth")
@Validated
public record WardenProperties(
        @NotBlank String serviceName,
        String environment,
        @Valid @NotNull Tokens tokens,
        @Valid Sessions sessions,
        @Valid ApiKeys apiKeys,
        @Valid Redis redis,
        @Valid Edge edge,
        Mfa mfa,
        List<@Valid ServiceRegistration> services,
        String roleSeed,
        Maintenance maintenance) {

    public WardenProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        sessions = sessions == null ? new Sessions(null, null, null, 0, 0) : sessions;
        apiKeys = apiKeys == null ? new ApiKeys(null, null, 0, 0, null, null, null) : apiKeys;
        redis = redis == null ? new Redis(null, 0, null, 0, false, null, null, null) : redis;
        edge = edge == null ? new Edge(null, null, null, null, null, null, null) : edge;
        mfa = mfa == null ? new Mfa(null) : mfa;
        services = services == null ? List.of() : List.copyOf(services);
        maintenance = maintenance == null ? new Maintenance(null) : maintenance;
    }

    /** Where sessions and rate-limit windows are kept. */
    public enum Backend {
        MEMORY,
        REDIS
    }

    /**
     * @param issuer          {@code iss} of issued tokens
     * @param audience        {@code aud} of issued tokens
     * @param accessTokenTtl  default 15 minutes
     * @param refreshTokenTtl default 7 days
     * @param serviceTokenTtl default 5 minutes
     * @param clockSkew       default 30 seconds
     * @param currentKeyId    key ID that signs new tokens
     * @param signingSecrets  HS256 secrets by key ID; older keys only verify
     */
    public record Tokens(
            @NotBlank String issuer,
            @NotBlank String audience,
            Duration accessTokenTtl,
            Duration refreshTokenTtl,
            Duration serviceTokenTtl,
            Duration clockSkew,
            @NotBlank String currentKeyId,
            @NotEmpty Map<String, String> signingSecrets) {
    }

    public record Sessions(Backend backend, Duration ttl, Boolean slidingExpiration, int maxPerUser,
                           int suspiciousActivityThreshold) {

        public Sessions {
            if (backend == null) {
                backend = Backend.MEMORY;
            }
            if (ttl == null) {
                ttl = Duration.ofHours(8);
            }
            if (slidingExpiration == null) {
                slidingExpiration = Boolean.TRUE;
            }
            if (maxPerUser <= 0) {
                maxPerUser = 5;
            }
            if (suspiciousActivityThreshold <= 0) {
                suspiciousActivityThreshold = 3;
            }
        }
    }

    public record ApiKeys(Backend rateLimitBackend, String keyPrefix, int maxPerUser, int defaultRateLimit,
                          WindowType defaultWindow, Duration defaultExpiry, Boolean requireHttps) {

        public ApiKeys {
            if (rateLimitBackend == null) {
                rateLimitBackend = Backend.MEMORY;
            }
            if (keyPrefix == null || keyPrefix.isBlank()) {
                keyPrefix = "wk_";
            }
            if (maxPerUser <= 0) {
                maxPerUser = 10;
            }
            if (defaultRateLimit <= 0) {
                defaultRateLimit = 1000;
            }
            if (defaultWindow == null) {
                defaultWindow = WindowType.HOUR;
            }
            if (defaultExpiry == null) {
                defaultExpiry = Duration.ofDays(90);
            }
            if (requireHttps == null) {
                requireHttps = Boolean.TRUE;
            }
        }
    }

    /**
     * @param keyPrefix prefix of every key this service writes
     */
    public record Redis(String host, int port, String password, int database, boolean ssl,
                        Duration connectTimeout, Duration socketTimeout, String keyPrefix) {

        public Redis {
            if (host == null || host.isBlank()) {
                host = "localhost";
            }
            if (port <= 0) {
                port = 6379;
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(2);
            }
            if (socketTimeout == null) {
                socketTimeout = Duration.ofSeconds(1);
            }
            if (keyPrefix == null || keyPrefix.isBlank()) {
                keyPrefix = "warden";
            }
        }

        @Override
        public String toString() {
            return "Redis[host=%s, port=%d, database=%d, ssl=%s]".formatted(host, port, database, ssl);
        }
    }

    /**
     * Header and cookie names default to those of {@link com.warden.security.edge.EdgeSettings}.
     */
    public record Edge(String accessTokenCookie, String tokenHeader, String serviceTokenHeader,
                       String apiKeyHeader, String tenantHeader, Duration mfaMaxAge,
                       List<@Valid Route> routes) {

        public Edge {
            routes = routes == null ? List.of() : List.copyOf(routes);
        }
    }

    /**
     * One row of the sensitivity table.
     *
     * @param permission RBAC grant in {@code action:resource} form, nullable
     */
    public record Route(@NotBlank String path, String method, @NotNull SensitivityTier tier,
                        Set<String> scopes, Set<String> roles, String permission,
                        Set<String> serviceOperations, boolean mfa) {

        public RouteRule toRule() {
            RouteRule rule = new RouteRule(path, method, tier, scopes, roles, null, serviceOperations, mfa);
            if (permission == null || permission.isBlank()) {
                return rule;
            }
            int separator = permission.indexOf(':');
            if (separator <= 0 || separator == permission.length() - 1) {
                throw new IllegalArgumentException(
                        "route permission must have the form action:resource, got '%s'".formatted(permission));
            }
            return rule.withPermission(permission.substring(0, separator), permission.substring(separator + 1));
        }
    }

    public record Mfa(Set<String> protectedScopes) {

        public Mfa {
            protectedScopes = protectedScopes == null ? Set.of() : Set.copyOf(protectedScopes);
        }
    }

    public record ServiceRegistration(@NotBlank String name, Set<String> targets, Set<String> operations) {
    }

    /**
     * @param interval delay between cleanup runs, default 5 minutes
     */
    public record Maintenance(Duration interval) {

        public Maintenance {
            if (interval == null) {
                interval = Duration.ofMinutes(5);
            }
        }
    }
}
