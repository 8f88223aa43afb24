package com.warden.security.token;

import java.util.Optional;

/**
 * Purpose of a token, carried in its {@code type} claim so one kind cannot be replayed as another.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh"),
    SERVICE("service");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
