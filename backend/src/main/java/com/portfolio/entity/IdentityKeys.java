package com.portfolio.entity;

import java.util.Locale;

/**
 * Normalization rules for the case-insensitive identity columns
 * ({@code name_key}, {@code email_key}).
 */
public final class IdentityKeys {

    private IdentityKeys() {
    }

    /**
     * Lower-cases and trims a value for use as a lookup key.
     *
     * @param value raw name or email, may be null
     * @return the key, or null when the value is null or blank
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Trims a value and maps blank input to null.
     *
     * @param value raw input, may be null
     * @return trimmed value or null
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
