package com.aegis.authservice.domain.error;

/**
 * Authorization denial. The caller is authenticated, so the message may be specific.
 */
public class ForbiddenException extends AuthServiceException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
