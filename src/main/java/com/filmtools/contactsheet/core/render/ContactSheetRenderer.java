package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.core.format.FormatCatalog;
import com.filmtools.contactsheet.core.format.FormatSpec;
import com.filmtools.contactsheet.core.layout.LayoutEngine;
import com.filmtools.contactsheet.core.layout.LayoutPlan;
import com.filmtools.contactsheet.core.layout.SheetLayout;
import com.filmtools.contactsheet.core.layout.SheetSettings;
import com.filmtools.contactsheet.core.model.MetadataInfo;
import com.filmtools.contactsheet.core.model.NumberedThumbnail;
import com.filmtools.contactsheet.logging.AppLogger;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Composites numbered thumbnails and footer metadata onto a fresh sheet canvas.
 */
public final class ContactSheetRenderer {
    private static final Logger LOGGER = AppLogger.get();

    private final FormatCatalog catalog;
    private final LayoutEngine layoutEngine;
    private final ThumbnailProducer thumbnails;
    private final String fontFamily;

    public ContactSheetRenderer(FormatCatalog catalog, SheetSettings settings) {
        this(catalog, new LayoutEngine(settings), new ThumbnailProducer(), FontRegistry.resolveSansSerifFamily());
    }

    public ContactSheetRenderer(FormatCatalog catalog,
                                LayoutEngine layoutEngine,
                                ThumbnailProducer thumbnails,
                                String fontFamily) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.layoutEngine = Objects.requireNonNull(layoutEngine, "layoutEngine");
        this.thumbnails = Objects.requireNonNull(thumbnails, "thumbnails");
        this.fontFamily = Objects.requireNonNull(fontFamily, "fontFamily");
    }

    /**
     * Grid plan the next {@link #render} with {@code imageCount} images of {@code format} will use.
     */
    public LayoutPlan plan(int imageCount, FormatSpec format) {
        return layoutEngine.plan(imageCount, format);
    }

    /**
     * Reduces a decoded scan to its cell box so full-resolution bitmaps can be released before compositing.
     */
    public BufferedImage fitToCell(BufferedImage image, LayoutPlan plan) {
        return thumbnails.resizeToFit(image, plan.cellWidth(), plan.cellHeight());
    }

    /**
     * Resolves {@code formatId} first so an unknown format fails before anything is allocated.
     */
    public Sheet render(List<NumberedThumbnail> images, String formatId, MetadataInfo metadata) {
        FormatSpec format = catalog.getFormat(formatId);
        return render(images, format, metadata);
    }

    public Sheet render(List<NumberedThumbnail> images, FormatSpec format, MetadataInfo metadata) {
        Objects.requireNonNull(images, "images");
        Objects.requireNonNull(format, "format");
        MetadataInfo info = metadata == null ? MetadataInfo.empty() : metadata;

        SheetLayout layout = layoutEngine.layout(images.size(), format);
        FooterLayout footer = FooterLayout.compute(layout, info);

        BufferedImage canvas = new BufferedImage(layout.canvas().width(), layout.canvas().height(),
            BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = canvas.createGraphics();
        try {
            ThumbnailProducer.setupHighQualityRendering(g2d);
            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

            placeThumbnails(g2d, images, layout);
            new FooterRenderer(layoutEngine.settings(), fontFamily).draw(g2d, footer, canvas.getWidth());
        } finally {
            g2d.dispose();
        }

        if (footer.filmOmitted()) {
            LOGGER.fine("Film line does not fit in the footer band and was omitted.");
        }
        LOGGER.info("Rendered %s sheet with %d image(s) at %dx%d px".formatted(
            format.displayName(), images.size(), canvas.getWidth(), canvas.getHeight()));
        return new Sheet(canvas, layout, footer);
    }

    private void placeThumbnails(Graphics2D g2d, List<NumberedThumbnail> images, SheetLayout layout) {
        LayoutPlan plan = layout.plan();
        for (int i = 0; i < images.size(); i++) {
            LayoutPlan.CellPosition cell = layout.cellAt(i);
            BufferedImage thumb = thumbnails.produce(images.get(i), plan.cellWidth(), plan.cellHeight());
            g2d.drawImage(thumb, cell.x(), cell.y(), null);
        }
    }
}
