package com.aegis.authservice.domain.error;

/**
 * The refresh token was already used or explicitly revoked.
 */
public class RevokedTokenException extends AuthServiceException {

    public RevokedTokenException(String jti) {
        super(ErrorCode.REVOKED_TOKEN, "Refresh token " + jti + " has been revoked");
    }
}
