package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.core.layout.SheetSettings;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.util.List;

/**
 * Draws the separator line and the metadata text of a sheet footer.
 */
final class FooterRenderer {

    private final Font bodyFont;
    private final Font filmFont;
    private final int separatorThickness;

    FooterRenderer(SheetSettings settings, String fontFamily) {
        this.bodyFont = new Font(fontFamily, Font.PLAIN, settings.bodyFontSize());
        this.filmFont = new Font(fontFamily, Font.BOLD, settings.filmFontSize());
        this.separatorThickness = settings.separatorThickness();
    }

    void draw(Graphics2D g2d, FooterLayout footer, int canvasWidth) {
        Color previous = g2d.getColor();
        g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g2d.setColor(Color.BLACK);

        if (separatorThickness > 0) {
            g2d.fillRect(footer.lineStartX(), footer.lineY(),
                footer.lineEndX() - footer.lineStartX(), separatorThickness);
        }

        drawColumn(g2d, footer.leftLines(), footer.leftX(), footer.textTop(), footer.lineHeight());
        drawColumn(g2d, footer.rightLines(), footer.rightX(), footer.textTop(), footer.lineHeight());

        if (footer.filmTop().isPresent()) {
            g2d.setFont(filmFont);
            FontMetrics fm = g2d.getFontMetrics();
            int textWidth = fm.stringWidth(footer.filmText());
            int x = (canvasWidth - textWidth) / 2;
            g2d.drawString(footer.filmText(), x, footer.filmTop().getAsInt() + fm.getAscent());
        }
        g2d.setColor(previous);
    }

    private void drawColumn(Graphics2D g2d, List<String> lines, int x, int top, int lineHeight) {
        g2d.setFont(bodyFont);
        FontMetrics fm = g2d.getFontMetrics();
        for (int i = 0; i < lines.size(); i++) {
            g2d.drawString(lines.get(i), x, top + i * lineHeight + fm.getAscent());
        }
    }
}
