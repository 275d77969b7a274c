package com.aegis.security;

/**
 * Thrown when a valid token is presented at the wrong use-site, e.g. a refresh token used as
 * a bearer access token.
 */
public class WrongTokenTypeException extends TokenException {

    private final TokenType expected;
    private final TokenType actual;

    public WrongTokenTypeException(TokenType expected, TokenType actual) {
        super("Expected %s token but got %s".formatted(expected.value(), actual.value()));
        this.expected = expected;
        this.actual = actual;
    }

    public TokenType expected() {
        return expected;
    }

    public TokenType actual() {
        return actual;
    }
}
