package com.aegis.authservice.domain.error;

import com.aegis.security.BadSignatureException;
import com.aegis.security.ExpiredTokenException;
import com.aegis.security.TokenException;
import com.aegis.security.WrongTokenTypeException;

/**
 * Stable, client-visible error codes and the HTTP status each one maps to.
 */
public enum ErrorCode {

    INVALID_CREDENTIALS(401, "Invalid email or password"),
    MISSING_CREDENTIALS(401, "Authentication required"),
    EXPIRED_TOKEN(401, "Token has expired"),
    REVOKED_TOKEN(401, "Token has been revoked"),
    BAD_SIGNATURE(401, "Token signature is invalid"),
    MALFORMED_TOKEN(401, "Token is malformed"),
    WRONG_TOKEN_TYPE(401, "Token cannot be used here"),
    INACTIVE_USER(401, "User account is inactive"),
    FORBIDDEN(403, "Insufficient permissions"),
    NOT_FOUND(404, "Resource not found"),
    DUPLICATE_EMAIL(409, "Email already registered"),
    VALIDATION(400, "Request is invalid"),
    UNAVAILABLE(503, "Service temporarily unavailable"),
    INTERNAL(500, "An unexpected error occurred");

    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /** Lower-case slug used in problem type URIs (e.g., "invalid-credentials"). */
    public String slug() {
        return name().toLowerCase().replace('_', '-');
    }

    /** Maps a token codec rejection onto its error code; anything unrecognised is malformed. */
    public static ErrorCode of(TokenException e) {
        if (e instanceof ExpiredTokenException) {
            return EXPIRED_TOKEN;
        }
        if (e instanceof BadSignatureException) {
            return BAD_SIGNATURE;
        }
        if (e instanceof WrongTokenTypeException) {
            return WRONG_TOKEN_TYPE;
        }
        return MALFORMED_TOKEN;
    }
}
