package com.warden.security.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link SigningKeyProvider} holding keys loaded from configuration.
 * <p>
 * {@link #rotate(SigningKey)} switches the signing key while keeping earlier keys available for
 * verification; {@link #retire(String)} ends the overlap for one of them.
 */
public final class StaticSigningKeyProvider implements SigningKeyProvider {

    private static final Logger log = LoggerFactory.getLogger(StaticSigningKeyProvider.class);

    private final Map<String, SigningKey> keys = new ConcurrentHashMap<>();
    private volatile SigningKey current;

    public StaticSigningKeyProvider(SigningKey current, SigningKey... previous) {
        if (current == null || !current.canSign()) {
            throw new IllegalArgumentException("current key must be able to sign");
        }
        for (SigningKey key : previous) {
            keys.put(key.keyId(), key);
        }
        keys.put(current.keyId(), current);
        this.current = current;
    }

    /**
     * Builds HS256 keys from {@code kid -> secret} pairs.
     *
     * @throws IllegalArgumentException if {@code currentKeyId} is not among the secrets
     */
    public static StaticSigningKeyProvider fromSecrets(Map<String, String> secretsByKeyId, String currentKeyId) {
        if (secretsByKeyId == null || !secretsByKeyId.containsKey(currentKeyId)) {
            throw new IllegalArgumentException("no secret configured for current key '%s'".formatted(currentKeyId));
        }
        SigningKey current = SigningKey.hmac(currentKeyId,
                secretsByKeyId.get(currentKeyId).getBytes(StandardCharsets.UTF_8));
        SigningKey[] previous = secretsByKeyId.entrySet().stream()
                .filter(e -> !e.getKey().equals(currentKeyId))
                .map(e -> SigningKey.hmac(e.getKey(), e.getValue().getBytes(StandardCharsets.UTF_8)))
                .toArray(SigningKey[]::new);
        return new StaticSigningKeyProvider(current, previous);
    }

    @Override
    public SigningKey currentKey() {
        return current;
    }

    @Override
    public Optional<SigningKey> keyById(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(keyId));
    }

    public synchronized void rotate(SigningKey next) {
        if (next == null || !next.canSign()) {
            throw new IllegalArgumentException("next key must be able to sign");
        }
        keys.put(next.keyId(), next);
        log.info("Rotated signing key from '{}' to '{}'", current.keyId(), next.keyId());
        current = next;
    }

    /**
     * Stops accepting tokens signed with the given key.
     *
     * @throws IllegalStateException if the key is the current signing key
     */
    public synchronized void retire(String keyId) {
        if (current.keyId().equals(keyId)) {
            throw new IllegalStateException("cannot retire the current signing key");
        }
        if (keys.remove(keyId) != null) {
            log.info("Retired signing key '{}'", keyId);
        }
    }
}
