package com.filmtools.contactsheet.core.layout;

import com.filmtools.contactsheet.core.format.FormatSpec;
import com.filmtools.contactsheet.logging.AppLogger;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Computes thumbnail cell size, grid extent and the canvas a contact sheet is drawn on.
 * <p>
 * The canvas keeps the configured target ratio while being large enough for the grid,
 * the margins, the gaps around the separator and the footer band. When that size would
 * exceed the maximum page it is clamped to the largest page-bounded size at the target
 * ratio, even though the grid may then overflow.
 */
public final class LayoutEngine {
    private static final Logger LOGGER = AppLogger.get();

    private final SheetSettings settings;

    public LayoutEngine(SheetSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public SheetSettings settings() {
        return settings;
    }

    public SheetLayout layout(int imageCount, FormatSpec format) {
        LayoutPlan plan = plan(imageCount, format);
        CanvasSize canvas = canvasFor(plan);
        LOGGER.fine(() -> "Layout for %d x %s: cell %dx%d, %d rows, canvas %dx%d%s".formatted(
            imageCount, format.id(), plan.cellWidth(), plan.cellHeight(), plan.rowsNeeded(),
            canvas.width(), canvas.height(), canvas.clamped() ? " (clamped)" : ""));
        return new SheetLayout(plan, canvas, settings);
    }

    public LayoutPlan plan(int imageCount, FormatSpec format) {
        Objects.requireNonNull(format, "format");
        if (imageCount < 0) {
            throw new IllegalArgumentException("imageCount must not be negative: " + imageCount);
        }
        int perRow = format.imagesPerRow();
        int cellGap = settings.cellGap();

        int availableWidth = settings.pageWidthBasis() - 2 * settings.margin();
        int gaps = (perRow - 1) * cellGap;
        int cellWidth = Math.floorDiv(availableWidth - gaps, perRow);
        cellWidth = Math.max(cellWidth, settings.minCellWidth());
        int cellHeight = (int) Math.round(cellWidth * format.aspectHeight() / format.aspectWidth());

        int rows = rowsNeeded(imageCount, perRow);
        int contentWidth = perRow * cellWidth + (perRow - 1) * cellGap;
        int contentHeight = rows * cellHeight + Math.max(0, rows - 1) * cellGap;

        return new LayoutPlan(cellWidth, cellHeight, rows, perRow, contentWidth, contentHeight);
    }

    public CanvasSize canvasFor(LayoutPlan plan) {
        long rw = settings.ratioWidth();
        long rh = settings.ratioHeight();
        long margin = settings.margin();

        long minHeight = 2 * margin
            + plan.contentHeight()
            + settings.unifiedGap()
            + settings.separatorThickness()
            + settings.unifiedGap()
            + settings.footerBand();
        long minWidth = plan.contentWidth() + 2 * margin;

        long heightFromWidth = minWidth * rh / rw;
        long widthFromHeight = minHeight * rw / rh;

        long finalWidth;
        long finalHeight;
        if (heightFromWidth >= minHeight && minWidth <= widthFromHeight) {
            finalWidth = Math.max(minWidth, widthFromHeight);
            finalHeight = finalWidth * rh / rw;
        } else {
            finalHeight = Math.max(minHeight, heightFromWidth);
            finalWidth = finalHeight * rw / rh;
        }

        if (finalHeight < minHeight) {
            finalHeight = minHeight;
            finalWidth = finalHeight * rw / rh;
        }
        if (finalWidth < minWidth) {
            finalWidth = minWidth;
            finalHeight = finalWidth * rh / rw;
        }

        long maxWidth = settings.maxPageWidth();
        long maxHeight = settings.maxPageHeight();
        if (finalWidth > maxWidth || finalHeight > maxHeight) {
            long requestedWidth = finalWidth;
            long requestedHeight = finalHeight;
            long heightForRatio = maxWidth * rh / rw;
            if (heightForRatio <= maxHeight) {
                finalWidth = maxWidth;
                finalHeight = heightForRatio;
            } else {
                finalHeight = maxHeight;
                finalWidth = maxHeight * rw / rh;
            }
            LOGGER.warning("Sheet of %dx%d px exceeds the maximum page; clamped to %dx%d px and content may not fit."
                .formatted(requestedWidth, requestedHeight, finalWidth, finalHeight));
            return new CanvasSize((int) finalWidth, (int) finalHeight, true);
        }
        return new CanvasSize((int) finalWidth, (int) finalHeight, false);
    }

    static int rowsNeeded(int imageCount, int imagesPerRow) {
        return (imageCount + imagesPerRow - 1) / imagesPerRow;
    }
}
