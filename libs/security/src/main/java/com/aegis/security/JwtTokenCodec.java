package com.aegis.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * {@link TokenCodec} producing compact JWS tokens with Nimbus JOSE+JWT.
 * <p>
 * Signing is pluggable: any {@link JWSSigner}/{@link JWSVerifier} pair for a single
 * {@link JWSAlgorithm}. Use {@link #hmac} for a shared secret.
 * <p>
 * Decode order is parse, algorithm, signature, claims, expiry, type. A tampered token is
 * therefore reported as {@link BadSignatureException} even when it is also expired.
 */
public final class JwtTokenCodec implements TokenCodec {

    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_ROLE = "role";

    private final JWSAlgorithm algorithm;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final String issuer;
    private final Clock clock;

    public JwtTokenCodec(
            JWSAlgorithm algorithm, JWSSigner signer, JWSVerifier verifier, String issuer, Clock clock) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        this.issuer = issuer;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates an HMAC codec (HS256, HS384 or HS512).
     *
     * @throws IllegalArgumentException if the algorithm is not an HMAC algorithm or the secret
     *                                  is shorter than the algorithm requires
     */
    public static JwtTokenCodec hmac(JWSAlgorithm algorithm, byte[] secret, String issuer, Clock clock) {
        if (!JWSAlgorithm.Family.HMAC_SHA.contains(algorithm)) {
            throw new IllegalArgumentException("Not an HMAC algorithm: " + algorithm);
        }
        try {
            return new JwtTokenCodec(algorithm, new MACSigner(secret), new MACVerifier(secret), issuer, clock);
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Signing secret rejected for " + algorithm + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String issue(TokenClaims claims) {
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder()
                .subject(claims.subject())
                .issuer(issuer)
                .issueTime(Date.from(claims.issuedAt()))
                .expirationTime(Date.from(claims.expiresAt()))
                .jwtID(claims.jti())
                .claim(CLAIM_TOKEN_TYPE, claims.tokenType().value());
        if (claims.isTenantScoped()) {
            builder.claim(CLAIM_TENANT_ID, claims.tenantId())
                    .claim(CLAIM_ROLE, claims.role().value());
        }

        SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(algorithm).type(JOSEObjectType.JWT).build(),
                builder.build());
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign " + claims.tokenType().value() + " token", e);
        }
        return jwt.serialize();
    }

    @Override
    public TokenClaims decode(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }

        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token.strip());
        } catch (ParseException e) {
            throw new MalformedTokenException("Token is not a well-formed JWS", e);
        }

        if (!algorithm.equals(jwt.getHeader().getAlgorithm())) {
            throw new BadSignatureException("Unexpected signing algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(verifier)) {
                throw new BadSignatureException("Signature verification failed");
            }
        } catch (JOSEException e) {
            throw new BadSignatureException("Signature verification failed", e);
        }

        TokenClaims claims = toClaims(jwt);
        if (claims.isExpiredAt(clock.instant())) {
            throw new ExpiredTokenException(claims.expiresAt());
        }
        if (claims.tokenType() != expectedType) {
            throw new WrongTokenTypeException(expectedType, claims.tokenType());
        }
        return claims;
    }

    private TokenClaims toClaims(SignedJWT jwt) {
        try {
            JWTClaimsSet set = jwt.getJWTClaimsSet();
            if (!issuer.equals(set.getIssuer())) {
                throw new BadSignatureException("Token was issued by '" + set.getIssuer() + "'");
            }
            TokenType type = TokenType.fromClaim(set.getStringClaim(CLAIM_TOKEN_TYPE))
                    .orElseThrow(() -> new MalformedTokenException("Missing or unknown token_type claim"));
            String tenantId = set.getStringClaim(CLAIM_TENANT_ID);
            String roleClaim = set.getStringClaim(CLAIM_ROLE);
            Role role = null;
            if (roleClaim != null) {
                role = Role.fromString(roleClaim)
                        .orElseThrow(() -> new MalformedTokenException("Unknown role claim '" + roleClaim + "'"));
            }
            return new TokenClaims(
                    set.getSubject(),
                    tenantId,
                    role,
                    type,
                    toInstant(set.getIssueTime(), "iat"),
                    toInstant(set.getExpirationTime(), "exp"),
                    set.getJWTID());
        } catch (ParseException e) {
            throw new MalformedTokenException("Token claims are not valid JSON", e);
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Token claims are incomplete: " + e.getMessage(), e);
        }
    }

    private static Instant toInstant(Date date, String claim) {
        if (date == null) {
            throw new MalformedTokenException("Missing " + claim + " claim");
        }
        return date.toInstant();
    }
}
