package com.aegis.authservice.domain.error;

/**
 * The identity or revocation store timed out or could not be reached.
 */
public class StoreUnavailableException extends AuthServiceException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UNAVAILABLE, message, cause);
    }
}
