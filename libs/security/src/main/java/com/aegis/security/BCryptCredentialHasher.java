package com.aegis.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * {@link CredentialHasher} backed by Spring Security's {@link BCryptPasswordEncoder}.
 * <p>
 * BCrypt compares the full digest without early exit, so verification time does not depend
 * on where a mismatch occurs.
 */
public final class BCryptCredentialHasher implements CredentialHasher {

    private static final Logger log = LoggerFactory.getLogger(BCryptCredentialHasher.class);

    /** {@code $2a$}, {@code $2b$} or {@code $2y$}, two-digit cost, 53 chars of salt + digest. */
    private static final Pattern BCRYPT_FORMAT =
            Pattern.compile("^\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}$");

    /** BCrypt ignores input past 72 bytes, so longer passwords are refused outright. */
    public static final int MAX_PASSWORD_BYTES = 72;

    public static final int DEFAULT_STRENGTH = 10;

    private final BCryptPasswordEncoder encoder;
    private final String dummyHash;

    public BCryptCredentialHasher() {
        this(DEFAULT_STRENGTH);
    }

    /**
     * @param strength log2 of the BCrypt work factor, 4..31
     */
    public BCryptCredentialHasher(int strength) {
        this.encoder = new BCryptPasswordEncoder(strength, new SecureRandom());
        this.dummyHash = encoder.encode("dummy-password-for-timing");
    }

    @Override
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        if (exceedsLimit(plaintext)) {
            throw new IllegalArgumentException(
                    "password must not exceed " + MAX_PASSWORD_BYTES + " UTF-8 bytes");
        }
        return encoder.encode(plaintext);
    }

    @Override
    public boolean verify(String plaintext, String encodedHash) {
        if (plaintext == null) {
            return false;
        }
        if (exceedsLimit(plaintext)) {
            log.debug("Password verification rejected input longer than {} bytes", MAX_PASSWORD_BYTES);
            return false;
        }
        try {
            checkFormat(encodedHash);
            return encoder.matches(plaintext, encodedHash);
        } catch (InvalidHashFormatException e) {
            log.warn("Password verification failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void dummyVerify(String plaintext) {
        verify(plaintext == null ? "" : plaintext, dummyHash);
    }

    /** True if the UTF-8 encoding is longer than {@link #MAX_PASSWORD_BYTES}. */
    public static boolean exceedsLimit(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }

    /**
     * Checks that a stored hash looks like a BCrypt hash.
     *
     * @throws InvalidHashFormatException if it does not
     */
    static void checkFormat(String encodedHash) {
        if (encodedHash == null || encodedHash.isEmpty()) {
            throw new InvalidHashFormatException("stored hash is empty");
        }
        if (!BCRYPT_FORMAT.matcher(encodedHash).matches()) {
            throw new InvalidHashFormatException("stored hash is not a BCrypt hash");
        }
    }
}
