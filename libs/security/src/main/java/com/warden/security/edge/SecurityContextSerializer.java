package com.warden.security.edge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Base64;

/**
 * Serializes and deserializes {@link SecurityContext} for forwarding to downstream services in
 * a single header value: JSON, then URL-safe Base64.
 * <p>
 * WHY JSON + Base64: header values must be plain ASCII without separators, and the context
 * carries role and scope sets. URL-safe Base64 of the JSON survives proxies unchanged.
 */
public final class SecurityContextSerializer {

    /** Header carrying the serialized context on forwarded requests. */
    public static final String HEADER = "X-Warden-Context";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SecurityContextSerializer() {
        // utility class
    }

    /**
     * Serializes a security context to a Base64-encoded JSON string.
     *
     * @throws SecuritySerializationException if serialization fails
     */
    public static String serialize(SecurityContext context) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(context);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new SecuritySerializationException("Failed to serialize security context", e);
        }
    }

    /**
     * Deserializes a Base64-encoded JSON string back to a security context.
     *
     * @throws SecuritySerializationException if the value is not a serialized context
     */
    public static SecurityContext deserialize(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new SecuritySerializationException("Security context value is empty", null);
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(encoded.strip());
            return MAPPER.readValue(json, SecurityContext.class);
        } catch (Exception e) {
            throw new SecuritySerializationException("Failed to deserialize security context", e);
        }
    }

    /**
     * Exception thrown when security context serialization/deserialization fails.
     */
    public static class SecuritySerializationException extends RuntimeException {
        public SecuritySerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
