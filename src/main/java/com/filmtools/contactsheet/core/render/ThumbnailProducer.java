package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.core.model.NumberedThumbnail;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;

/**
 * Produces the fixed-size, numbered thumbnails placed into sheet cells.
 */
public final class ThumbnailProducer {
    static final int BADGE_PADDING = 5;
    static final int BADGE_INSET = 2;
    static final int BADGE_ARC = 6;
    static final int BADGE_FONT_SIZE = 20;

    private final Font badgeFont;

    public ThumbnailProducer() {
        this(FontRegistry.sansSerif(Font.PLAIN, BADGE_FONT_SIZE));
    }

    public ThumbnailProducer(Font badgeFont) {
        this.badgeFont = badgeFont;
    }

    /**
     * Scales {@code source} to fit inside a {@code width x height} box without enlarging it and
     * centres it on a black background of exactly that size.
     */
    public BufferedImage resizeToFit(BufferedImage source, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Thumbnail box must be positive: " + width + "x" + height);
        }
        double scale = Math.min(1.0, Math.min((double) width / source.getWidth(), (double) height / source.getHeight()));
        int scaledWidth = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int scaledHeight = Math.max(1, (int) Math.round(source.getHeight() * scale));
        scaledWidth = Math.min(scaledWidth, width);
        scaledHeight = Math.min(scaledHeight, height);

        BufferedImage box = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = box.createGraphics();
        try {
            setupHighQualityRendering(g);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, width, height);
            int x = (width - scaledWidth) / 2;
            int y = (height - scaledHeight) / 2;
            g.drawImage(source, x, y, scaledWidth, scaledHeight, null);
        } finally {
            g.dispose();
        }
        return box;
    }

    /**
     * Returns a copy of {@code image} with {@code number} on a white badge in the top-left corner.
     */
    public BufferedImage overlayNumber(BufferedImage image, int number) {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setFont(badgeFont);
            FontMetrics fm = g.getFontMetrics();
            String text = Integer.toString(number);
            int textWidth = fm.stringWidth(text);
            int textHeight = fm.getAscent();

            RoundRectangle2D badge = new RoundRectangle2D.Double(
                BADGE_PADDING - BADGE_INSET,
                BADGE_PADDING - BADGE_INSET,
                textWidth + 2 * BADGE_INSET,
                textHeight + 2 * BADGE_INSET,
                BADGE_ARC,
                BADGE_ARC);
            g.setColor(Color.WHITE);
            g.fill(badge);
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1f));
            g.draw(badge);
            g.drawString(text, BADGE_PADDING, BADGE_PADDING + fm.getAscent());
        } finally {
            g.dispose();
        }
        return copy;
    }

    public BufferedImage produce(NumberedThumbnail source, int width, int height) {
        return overlayNumber(resizeToFit(source.image(), width, height), source.sequence());
    }

    static void setupHighQualityRendering(Graphics2D g2d) {
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    }
}
