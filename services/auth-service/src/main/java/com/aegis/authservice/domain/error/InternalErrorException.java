package com.aegis.authservice.domain.error;

/**
 * An internal invariant was violated. Always a programming or data error, never a client one.
 */
public class InternalErrorException extends AuthServiceException {

    public InternalErrorException(String message) {
        super(ErrorCode.INTERNAL, message);
    }

    public InternalErrorException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL, message, cause);
    }
}
