package com.warden.security.apikey;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link ApiKeyStore}.
 */
public final class InMemoryApiKeyStore implements ApiKeyStore {

    private final Map<String, ApiKey> keys = new ConcurrentHashMap<>();
    private final Map<String, String> keyIdsByHash = new ConcurrentHashMap<>();

    @Override
    public void save(ApiKey key) {
        keys.put(key.keyId(), key);
        keyIdsByHash.put(key.keyHash(), key.keyId());
    }

    @Override
    public Optional<ApiKey> findById(String keyId) {
        return keyId == null ? Optional.empty() : Optional.ofNullable(keys.get(keyId));
    }

    @Override
    public Optional<ApiKey> findByHash(String keyHash) {
        String keyId = keyHash == null ? null : keyIdsByHash.get(keyHash);
        return findById(keyId);
    }

    @Override
    public List<ApiKey> listByUser(String userId) {
        return keys.values().stream().filter(k -> k.userId().equals(userId)).toList();
    }

    @Override
    public Optional<ApiKey> update(String keyId, UnaryOperator<ApiKey> change) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.computeIfPresent(keyId, (id, current) -> change.apply(current)));
    }
}
