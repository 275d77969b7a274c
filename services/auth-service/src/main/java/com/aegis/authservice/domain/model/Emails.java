package com.aegis.authservice.domain.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email address helpers. Uniqueness is global and case-insensitive, so every lookup and every
 * uniqueness check goes through {@link #normalize(String)}.
 */
public final class Emails {

    private static final Pattern SHAPE = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static final int MAX_LENGTH = 320;

    private Emails() {
        // utility class
    }

    /** Lower-cases (root locale) and strips surrounding whitespace. */
    public static String normalize(String email) {
        if (email == null) {
            throw new IllegalArgumentException("email must not be null");
        }
        return email.strip().toLowerCase(Locale.ROOT);
    }

    /** Loose syntactic check: one {@code @}, a dot in the domain, no whitespace. */
    public static boolean isWellFormed(String email) {
        return email != null
                && email.strip().length() <= MAX_LENGTH
                && SHAPE.matcher(email.strip()).matches();
    }
}
