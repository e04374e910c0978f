package com.filmtools.contactsheet.core.format;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Fixed geometric rules for one film format: frame aspect, grid width and rotation policy.
 */
public record FormatSpec(String id,
                         String displayName,
                         double aspectWidth,
                         double aspectHeight,
                         int imagesPerRow,
                         Integer maxImages,
                         Orientation orientation,
                         boolean forceRotation) {

    public FormatSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(orientation, "orientation");
        if (aspectWidth <= 0 || aspectHeight <= 0) {
            throw new IllegalArgumentException("Aspect ratio must be positive for format " + id);
        }
        if (imagesPerRow <= 0) {
            throw new IllegalArgumentException("imagesPerRow must be > 0 for format " + id);
        }
        if (maxImages != null && maxImages <= 0) {
            throw new IllegalArgumentException("maxImages must be > 0 for format " + id);
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }

    public OptionalInt maxImageCount() {
        return maxImages == null ? OptionalInt.empty() : OptionalInt.of(maxImages);
    }

    @Override
    public String toString() {
        return displayName + " (" + id + ")";
    }
}
