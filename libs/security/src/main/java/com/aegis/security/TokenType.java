package com.aegis.security;

import java.util.Optional;

/**
 * The use-site a token was minted for. Access and refresh tokens share one codec but are
 * never interchangeable.
 */
public enum TokenType {

    ACCESS("access"),
    REFRESH("refresh");

    private final String value;

    TokenType(String value) {
        this.value = value;
    }

    /** The claim value written into the token (e.g., "refresh"). */
    public String value() {
        return value;
    }

    public static Optional<TokenType> fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
