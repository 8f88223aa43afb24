package com.warden.security.apikey;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence contract for API keys.
 */
public interface ApiKeyStore {

    void save(ApiKey key);

    Optional<ApiKey> findById(String keyId);

    Optional<ApiKey> findByHash(String keyHash);

    List<ApiKey> listByUser(String userId);

    /**
     * Atomically replaces the key with {@code change} applied to its current value.
     *
     * @return the stored result, or empty if the key does not exist
     */
    Optional<ApiKey> update(String keyId, UnaryOperator<ApiKey> change);
}
