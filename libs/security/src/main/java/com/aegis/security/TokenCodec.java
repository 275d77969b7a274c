package com.aegis.security;

/**
 * Encodes and decodes self-contained, signed, expiring tokens.
 * <p>
 * Implementations need no external lookup to check signature or expiry. Revocation is not
 * the codec's concern.
 */
public interface TokenCodec {

    /**
     * Signs the claims into a compact token string. TTL is already folded into
     * {@link TokenClaims#expiresAt()}.
     */
    String issue(TokenClaims claims);

    /**
     * Verifies and decodes a token for a specific use-site.
     *
     * @param token        the compact token string
     * @param expectedType the token type the caller accepts
     * @return the decoded claims
     * @throws MalformedTokenException  if the token cannot be parsed or lacks required claims
     * @throws BadSignatureException    if the signature does not verify
     * @throws ExpiredTokenException    if the token is past its expiry
     * @throws WrongTokenTypeException  if the token type differs from {@code expectedType}
     */
    TokenClaims decode(String token, TokenType expectedType);
}
