package com.filmtools.contactsheet.core.model;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A decoded scan together with the file it came from.
 */
public record SourceImage(Path path, BufferedImage image) {

    public SourceImage {
        Objects.requireNonNull(image, "image");
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
