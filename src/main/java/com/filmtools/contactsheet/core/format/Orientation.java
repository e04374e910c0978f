package com.filmtools.contactsheet.core.format;

import java.util.Locale;

/**
 * Frame orientation a film format expects its scans to have.
 */
public enum Orientation {
    LANDSCAPE,
    PORTRAIT,
    SQUARE;

    public static Orientation parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Orientation is required");
        }
        return Orientation.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
