package com.warden.security.token;

import java.util.Optional;

/**
 * Capability interface of the secrets backend as seen by token issuance.
 * <p>
 * During a rotation overlap {@link #keyById(String)} still resolves the previous key so tokens
 * signed before the rotation verify until they expire.
 */
public interface SigningKeyProvider {

    /** Key that signs newly issued tokens. */
    SigningKey currentKey();

    /** Key for verifying a token carrying the given {@code kid}. */
    Optional<SigningKey> keyById(String keyId);
}
