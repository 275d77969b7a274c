package com.aegis.authservice.domain.error;

/**
 * No bearer token was presented on an endpoint that requires one.
 */
public class MissingCredentialsException extends AuthServiceException {

    public MissingCredentialsException() {
        super(ErrorCode.MISSING_CREDENTIALS, "Missing or malformed Authorization header");
    }
}
