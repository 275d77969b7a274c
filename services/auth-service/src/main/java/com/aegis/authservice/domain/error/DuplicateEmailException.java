package com.aegis.authservice.domain.error;

/**
 * An account with this email already exists (compared case-insensitively).
 */
public class DuplicateEmailException extends AuthServiceException {

    public DuplicateEmailException() {
        super(ErrorCode.DUPLICATE_EMAIL, ErrorCode.DUPLICATE_EMAIL.defaultMessage());
    }

    public DuplicateEmailException(Throwable cause) {
        super(ErrorCode.DUPLICATE_EMAIL, ErrorCode.DUPLICATE_EMAIL.defaultMessage(), cause);
    }
}
