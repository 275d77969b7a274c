package com.aegis.security;

/**
 * Thrown when a token cannot be parsed or lacks a required claim.
 */
public class MalformedTokenException extends TokenException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
