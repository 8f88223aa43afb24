package com.warden.security.token;

import java.time.Instant;
import java.util.Set;

/**
 * Registration of a service allowed to mint service tokens.
 *
 * @param serviceName       unique service name, the {@code sub} of its tokens
 * @param allowedTargets    services it may address
 * @param allowedOperations operations it may request; {@code *} allows any
 * @param identityId        registration ID, changes on re-registration
 * @param createdAt         registration time
 */
public record ServiceIdentity(
        String serviceName,
        Set<String> allowedTargets,
        Set<String> allowedOperations,
        String identityId,
        Instant createdAt
) {

    public static final String ANY_OPERATION = "*";

    public ServiceIdentity {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        allowedTargets = allowedTargets == null ? Set.of() : Set.copyOf(allowedTargets);
        allowedOperations = allowedOperations == null ? Set.of() : Set.copyOf(allowedOperations);
    }

    public boolean allowsTarget(String target) {
        return allowedTargets.contains(target);
    }

    public boolean allowsOperation(String operation) {
        return allowedOperations.contains(ANY_OPERATION) || allowedOperations.contains(operation);
    }
}
