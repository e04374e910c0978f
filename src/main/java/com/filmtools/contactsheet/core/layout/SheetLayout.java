package com.filmtools.contactsheet.core.layout;

import java.util.Objects;

/**
 * Grid plan plus the canvas it is placed on.
 */
public record SheetLayout(LayoutPlan plan, CanvasSize canvas, SheetSettings settings) {

    public SheetLayout {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(canvas, "canvas");
        Objects.requireNonNull(settings, "settings");
    }

    /** Left edge of the horizontally centred grid. */
    public int gridStartX() {
        return (canvas.width() - plan.contentWidth()) / 2;
    }

    /** Top edge of the grid; the grid is not centred vertically. */
    public int gridStartY() {
        return settings.margin();
    }

    /** Y of the separator line that opens the footer band. */
    public int footerTop() {
        return canvas.height() - settings.margin() - settings.footerBand();
    }

    public LayoutPlan.CellPosition cellAt(int index) {
        return plan.cellAt(index, gridStartX(), gridStartY(), settings.cellGap());
    }
}
