package com.aegis.security;

/**
 * Base type for every reason a presented token is rejected by a {@link TokenCodec}.
 * <p>
 * Subclasses are distinct because they are distinct security signals: an expired token is
 * routine, a bad signature means someone tampered with or forged it.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
