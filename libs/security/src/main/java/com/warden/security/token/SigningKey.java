package com.warden.security.token;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.keys.HmacKey;

import java.security.Key;
import java.security.KeyPair;

/**
 * Key material for one {@code kid}. For HMAC both sides use the same secret; for RSA the private
 * key signs and the public key verifies.
 */
public record SigningKey(String keyId, String algorithm, Key signingKey, Key verificationKey) {

    /** Minimum HS256 secret length in bytes. */
    public static final int MIN_HMAC_SECRET_BYTES = 32;

    public SigningKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be null or blank");
        }
        if (algorithm == null || verificationKey == null) {
            throw new IllegalArgumentException("algorithm and verificationKey must not be null");
        }
    }

    public static SigningKey hmac(String keyId, byte[] secret) {
        if (secret == null || secret.length < MIN_HMAC_SECRET_BYTES) {
            throw new IllegalArgumentException("HMAC secret must be at least %d bytes"
                    .formatted(MIN_HMAC_SECRET_BYTES));
        }
        HmacKey key = new HmacKey(secret);
        return new SigningKey(keyId, AlgorithmIdentifiers.HMAC_SHA256, key, key);
    }

    public static SigningKey rsa(String keyId, KeyPair keyPair) {
        return new SigningKey(keyId, AlgorithmIdentifiers.RSA_USING_SHA256,
                keyPair.getPrivate(), keyPair.getPublic());
    }

    /** Whether this key can still sign, as opposed to a verification-only public key. */
    public boolean canSign() {
        return signingKey != null;
    }

    @Override
    public String toString() {
        return "SigningKey[keyId=%s, algorithm=%s]".formatted(keyId, algorithm);
    }
}
