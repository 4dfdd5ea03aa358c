package dev.gazettemonitor.service;

import java.util.regex.Pattern;

/**
 * Email grammar shared by job, search and settings validation.
 */
public final class EmailAddresses {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private EmailAddresses() {
    }

    public static boolean isValid(String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    /**
     * Trimmed address, or null when the input is null or blank.
     */
    public static String normalize(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim();
    }
}
