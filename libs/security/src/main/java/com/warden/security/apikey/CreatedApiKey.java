package com.warden.security.apikey;

import com.warden.observability.SensitiveDataRedactor;

/**
 * A freshly created or rotated key together with its raw value. The raw value exists only in
 * this object and must be handed to the caller once.
 */
public record CreatedApiKey(ApiKey key, String rawKey) {

    @Override
    public String toString() {
        return "CreatedApiKey[key=%s, rawKey=%s]".formatted(key, SensitiveDataRedactor.mask(rawKey));
    }
}
