package com.warden.security.token;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Service-to-service credentials: a live registry of {@link ServiceIdentity}s plus issuance and
 * verification of short-lived tokens scoped to one target service and an operation allow-list.
 * <p>
 * Every verification consults the registry, so deregistering a service revokes its outstanding
 * tokens immediately.
 */
public final class ServiceTokenService {

    private static final Logger log = LoggerFactory.getLogger(ServiceTokenService.class);

    private final JwtCodec codec;
    private final ConcurrentMap<String, ServiceIdentity> registry = new ConcurrentHashMap<>();

    public ServiceTokenService(JwtCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec must not be null");
        }
        this.codec = codec;
    }

    /**
     * @throws AuthException CONFIGURATION_ERROR if the name is already registered
     */
    public ServiceIdentity registerService(String serviceName, Set<String> allowedTargets,
                                           Set<String> allowedOperations) {
        ServiceIdentity identity = new ServiceIdentity(serviceName, allowedTargets, allowedOperations,
                UUID.randomUUID().toString(), codec.clock().instant());
        if (registry.putIfAbsent(serviceName, identity) != null) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR,
                    "Service '%s' is already registered".formatted(serviceName));
        }
        log.info("Registered service '{}' targets={} operations={}",
                serviceName, identity.allowedTargets(), identity.allowedOperations());
        return identity;
    }

    public boolean deregisterService(String serviceName) {
        boolean removed = registry.remove(serviceName) != null;
        if (removed) {
            log.info("Deregistered service '{}'", serviceName);
        }
        return removed;
    }

    public Optional<ServiceIdentity> getService(String serviceName) {
        return Optional.ofNullable(registry.get(serviceName));
    }

    /**
     * Mints a token for {@code serviceName} to call {@code targetService}. The registration must
     * list the target and every requested operation before anything is signed.
     *
     * @throws AuthException UNAUTHORIZED_SERVICE otherwise
     */
    public String issueServiceToken(String serviceName, String targetService, Collection<String> operations) {
        ServiceIdentity identity = registry.get(serviceName);
        if (identity == null) {
            throw new AuthException(AuthErrorKind.UNAUTHORIZED_SERVICE,
                    "Service '%s' is not registered".formatted(serviceName));
        }
        if (!identity.allowsTarget(targetService)) {
            throw new AuthException(AuthErrorKind.UNAUTHORIZED_SERVICE,
                    "Service '%s' may not call '%s'".formatted(serviceName, targetService));
        }
        List<String> requested = operations == null ? List.of() : List.copyOf(operations);
        for (String operation : requested) {
            if (!identity.allowsOperation(operation)) {
                throw new AuthException(AuthErrorKind.UNAUTHORIZED_SERVICE,
                        "Service '%s' may not request operation '%s'".formatted(serviceName, operation));
            }
        }
        TokenSettings settings = codec.settings();
        Instant now = codec.clock().instant();
        TokenClaims claims = new TokenClaims(
                serviceName, null, List.of(), List.of(),
                now, now.plus(settings.serviceTokenTtl()),
                UUID.randomUUID().toString(),
                settings.issuer(), settings.audience(),
                TokenType.SERVICE, targetService, requested, identity.identityId(), null);
        return codec.encode(claims);
    }

    /**
     * Verifies a service token.
     *
     * @param expectedTarget     name of the verifying service, or null to skip the target check
     * @param requiredOperations operations the caller is about to perform
     * @throws AuthException signature/expiry kinds from decoding, INVALID_TOKEN_TYPE for user
     *                       tokens, UNAUTHORIZED_SERVICE for target, operation or registry failures
     */
    public TokenClaims verifyServiceToken(String token, String expectedTarget, Collection<String> requiredOperations) {
        TokenClaims claims = codec.decode(token);
        if (!claims.isService()) {
            throw new AuthException(AuthErrorKind.INVALID_TOKEN_TYPE, "Expected service token");
        }
        if (expectedTarget != null && !expectedTarget.equals(claims.targetService())) {
            throw new AuthException(AuthErrorKind.UNAUTHORIZED_SERVICE, "Service token not addressed to this service");
        }
        if (requiredOperations != null && !claims.allowedOperations().contains(ServiceIdentity.ANY_OPERATION)
                && !claims.allowedOperations().containsAll(requiredOperations)) {
            throw new AuthException(AuthErrorKind.UNAUTHORIZED_SERVICE, "Service token does not allow this operation");
        }
        ServiceIdentity identity = registry.get(claims.subject());
        if (identity == null || !identity.identityId().equals(claims.identityId())) {
            throw new AuthException(AuthErrorKind.UNAUTHORIZED_SERVICE, "Service is no longer registered");
        }
        return claims;
    }
}
