package com.aegis.authservice.domain.error;

/**
 * Base type for every recoverable failure the auth core reports. Each carries a stable
 * {@link ErrorCode}; the web layer maps it to a status and problem body.
 */
public class AuthServiceException extends RuntimeException {

    private final ErrorCode code;

    public AuthServiceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AuthServiceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
