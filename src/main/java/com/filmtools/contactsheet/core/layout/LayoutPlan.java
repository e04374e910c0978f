package com.filmtools.contactsheet.core.layout;

/**
 * Grid geometry for one render: cell size, row count and the content bounding box.
 */
public record LayoutPlan(int cellWidth,
                         int cellHeight,
                         int rowsNeeded,
                         int imagesPerRow,
                         int contentWidth,
                         int contentHeight) {

    /**
     * Top-left corner of the cell holding the image at {@code index} (0-based, row-major).
     */
    public CellPosition cellAt(int index, int startX, int startY, int cellGap) {
        int row = index / imagesPerRow;
        int col = index % imagesPerRow;
        return new CellPosition(row, col,
            startX + col * (cellWidth + cellGap),
            startY + row * (cellHeight + cellGap));
    }

    public record CellPosition(int row, int col, int x, int y) {
    }
}
