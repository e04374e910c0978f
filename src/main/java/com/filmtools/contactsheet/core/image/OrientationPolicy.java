package com.filmtools.contactsheet.core.image;

import com.filmtools.contactsheet.core.format.FormatSpec;
import com.filmtools.contactsheet.core.format.Orientation;

import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Turns scans to match the frame orientation of formats that force rotation.
 */
public final class OrientationPolicy {

    private OrientationPolicy() {
    }

    public static boolean needsRotation(int width, int height, FormatSpec format) {
        if (!format.forceRotation()) {
            return false;
        }
        boolean landscape = width > height;
        boolean portrait = height > width;
        return (format.orientation() == Orientation.LANDSCAPE && portrait)
            || (format.orientation() == Orientation.PORTRAIT && landscape);
    }

    /**
     * Returns the image rotated 90 degrees counter-clockwise when the format requires it,
     * otherwise the same instance.
     */
    public static BufferedImage apply(BufferedImage image, FormatSpec format) {
        if (!needsRotation(image.getWidth(), image.getHeight(), format)) {
            return image;
        }
        return rotateCounterClockwise(image);
    }

    static BufferedImage rotateCounterClockwise(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage rotated = new BufferedImage(h, w, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rotated.createGraphics();
        try {
            AffineTransform transform = new AffineTransform();
            transform.translate(0, w);
            transform.quadrantRotate(-1);
            g.drawImage(image, transform, null);
        } finally {
            g.dispose();
        }
        return rotated;
    }
}
