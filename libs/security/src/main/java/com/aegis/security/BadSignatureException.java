package com.aegis.security;

/**
 * Thrown when a token's signature does not verify against the configured key, or the token
 * was signed with an algorithm this codec does not accept.
 */
public class BadSignatureException extends TokenException {

    public BadSignatureException(String message) {
        super(message);
    }

    public BadSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
