package com.aegis.security;

/**
 * Thrown when a stored password hash is not in a format the hasher understands.
 */
public class InvalidHashFormatException extends RuntimeException {

    public InvalidHashFormatException(String message) {
        super(message);
    }
}
