package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.core.layout.SheetLayout;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A composited contact sheet held in memory until it is exported or replaced.
 */
public record Sheet(BufferedImage image, SheetLayout layout, FooterLayout footer) {

    public Sheet {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(footer, "footer");
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public int dpi() {
        return layout.settings().dpi();
    }
}
