package com.aegis.authservice.domain.error;

/**
 * Login failed. Deliberately identical for an unknown email and a wrong password.
 */
public class InvalidCredentialsException extends AuthServiceException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS, ErrorCode.INVALID_CREDENTIALS.defaultMessage());
    }
}
