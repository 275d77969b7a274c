package com.aegis.authservice.api.dto;

import com.aegis.authservice.domain.model.TokenPair;

/**
 * Token pair as returned by login and refresh.
 *
 * @param expiresIn access token lifetime in seconds
 */
public record TokenResponse(
        String accessToken, String refreshToken, String tokenType, long expiresIn) {

    public static final String BEARER = "bearer";

    public static TokenResponse from(TokenPair pair) {
        return new TokenResponse(
                pair.accessToken(), pair.refreshToken(), BEARER, pair.accessExpiresInSeconds());
    }
}
