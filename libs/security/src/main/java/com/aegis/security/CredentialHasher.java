package com.aegis.security;

/**
 * One-way password hashing with verification.
 * <p>
 * Hashes are opaque strings that embed their own salt and cost parameters, so two hashes of
 * the same password never match byte-for-byte.
 */
public interface CredentialHasher {

    /**
     * Hashes a plaintext password with a fresh random salt.
     *
     * @param plaintext the password (must not be null)
     * @return the opaque encoded hash
     */
    String hash(String plaintext);

    /**
     * Checks a plaintext password against a stored hash. Never throws for bad input: a null
     * or malformed hash is a failed verification.
     *
     * @return true only if the password matches
     */
    boolean verify(String plaintext, String encodedHash);

    /**
     * Performs one verification against a fixed hash and discards the result. Callers use it
     * when there is no stored hash to check, so the failure costs as much time as a real one.
     */
    void dummyVerify(String plaintext);
}
