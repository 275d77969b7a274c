package com.aegis.observability;

/**
 * Keeps personal data out of log output. {@link #maskEmail(String)} keeps enough of an
 * address to correlate support requests without logging it in full.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private SensitiveDataRedactor() {
        // utility class
    }

    /**
     * Masks the local part of an email address: {@code alice@x.com} becomes {@code a***@x.com}.
     * Values that are not addresses are fully redacted.
     */
    public static String maskEmail(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        if (at <= 0 || at == email.length() - 1) {
            return REDACTED;
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
