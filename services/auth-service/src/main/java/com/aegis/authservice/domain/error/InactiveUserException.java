package com.aegis.authservice.domain.error;

/**
 * The credentials were correct but the account has been deactivated.
 */
public class InactiveUserException extends AuthServiceException {

    public InactiveUserException() {
        super(ErrorCode.INACTIVE_USER, ErrorCode.INACTIVE_USER.defaultMessage());
    }
}
