package com.warden.security.rbac;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads and writes {@link RoleConfig} as JSON, the format of role seed files and backups.
 */
public final class RoleConfigCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private RoleConfigCodec() {
        // utility class
    }

    public static String toJson(RoleConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (IOException e) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR, "Failed to write role config", e);
        }
    }

    public static RoleConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, RoleConfig.class);
        } catch (IOException e) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR, "Invalid role config", e);
        }
    }

    public static RoleConfig read(InputStream in) {
        try {
            return MAPPER.readValue(in, RoleConfig.class);
        } catch (IOException e) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR, "Invalid role config", e);
        }
    }
}
