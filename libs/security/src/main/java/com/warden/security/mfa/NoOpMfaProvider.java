package com.warden.security.mfa;

import java.util.Collection;
import java.util.Optional;

/**
 * {@link MfaProvider} for deployments with MFA disabled: never requires it, knows no challenges.
 */
public final class NoOpMfaProvider implements MfaProvider {

    @Override
    public boolean isRequiredFor(String subject, Collection<String> scopes) {
        return false;
    }

    @Override
    public Optional<MfaClaims> completedChallenge(String subject, String challengeId) {
        return Optional.empty();
    }
}
