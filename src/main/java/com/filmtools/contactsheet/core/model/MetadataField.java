package com.filmtools.contactsheet.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of metadata lines a sheet footer can carry.
 */
public enum MetadataField {
    DATE("date", "Date"),
    LOCATION("location", "Location"),
    DEVELOPER("developer", "Developer"),
    CAMERA("camera", "Camera"),
    LENS("lens", "Lens"),
    FILM("film", "Film");

    private final String key;
    private final String label;

    MetadataField(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public static Optional<MetadataField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (MetadataField field : values()) {
            if (field.key.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
