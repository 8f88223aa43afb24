package com.warden.security.mfa;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Requires MFA for a configured set of sensitive scopes and delegates challenge lookups to
 * another provider.
 */
public final class ScopeBasedMfaPolicy implements MfaProvider {

    private final Set<String> protectedScopes;
    private final MfaProvider challenges;

    public ScopeBasedMfaPolicy(Set<String> protectedScopes, MfaProvider challenges) {
        this.protectedScopes = protectedScopes == null ? Set.of() : Set.copyOf(protectedScopes);
        this.challenges = challenges == null ? new NoOpMfaProvider() : challenges;
    }

    @Override
    public boolean isRequiredFor(String subject, Collection<String> scopes) {
        if (scopes == null) {
            return false;
        }
        for (String scope : scopes) {
            if (protectedScopes.contains(scope)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<MfaClaims> completedChallenge(String subject, String challengeId) {
        return challenges.completedChallenge(subject, challengeId);
    }
}
