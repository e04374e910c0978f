package com.filmtools.contactsheet.core.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * An image paired with the frame number printed on its badge.
 */
public record NumberedThumbnail(BufferedImage image, int sequence) {

    public NumberedThumbnail {
        Objects.requireNonNull(image, "image");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1: " + sequence);
        }
    }
}
