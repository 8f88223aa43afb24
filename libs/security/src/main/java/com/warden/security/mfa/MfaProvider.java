package com.warden.security.mfa;

import java.util.Collection;
import java.util.Optional;

/**
 * Capability interface of the MFA subsystem. Enrollment, challenge delivery and factor
 * verification live behind it; the core only asks whether MFA is required and collects the
 * claims of a completed challenge.
 * <p>
 * Deployments without MFA wire {@link NoOpMfaProvider}.
 */
public interface MfaProvider {

    /**
     * Whether the subject must present fresh MFA claims to use any of the given scopes.
     */
    boolean isRequiredFor(String subject, Collection<String> scopes);

    /**
     * Claims of a challenge the subject has completed, or empty if the challenge is unknown,
     * failed or belongs to someone else.
     */
    Optional<MfaClaims> completedChallenge(String subject, String challengeId);
}
