package com.filmtools.contactsheet.core.layout;

/**
 * Physical constants a contact sheet is laid out with.
 * <p>
 * Lengths are kept in millimetres (or points for type) and converted to pixels at the
 * configured DPI with {@code px = round(mm * dpi / 25.4)}. The inter-cell gap and the
 * separator thickness are plain pixel values.
 */
public final class SheetSettings {
    public static final double MM_PER_INCH = 25.4;
    public static final double POINTS_PER_INCH = 72.0;

    private static final SheetSettings DEFAULTS = builder().build();

    private final int dpi;
    private final double marginMm;
    private final double footerBandMm;
    private final double unifiedGapMm;
    private final double minCellWidthMm;
    private final double pageWidthBasisMm;
    private final double maxPageWidthMm;
    private final double maxPageHeightMm;
    private final int cellGapPx;
    private final int separatorPx;
    private final int ratioWidth;
    private final int ratioHeight;
    private final double bodyFontPt;
    private final double filmFontPt;
    private final double lineHeightPt;
    private final double filmLineReservePt;

    private SheetSettings(Builder b) {
        this.dpi = b.dpi;
        this.marginMm = b.marginMm;
        this.footerBandMm = b.footerBandMm;
        this.unifiedGapMm = b.unifiedGapMm;
        this.minCellWidthMm = b.minCellWidthMm;
        this.pageWidthBasisMm = b.pageWidthBasisMm;
        this.maxPageWidthMm = b.maxPageWidthMm;
        this.maxPageHeightMm = b.maxPageHeightMm;
        this.cellGapPx = b.cellGapPx;
        this.separatorPx = b.separatorPx;
        this.ratioWidth = b.ratioWidth;
        this.ratioHeight = b.ratioHeight;
        this.bodyFontPt = b.bodyFontPt;
        this.filmFontPt = b.filmFontPt;
        this.lineHeightPt = b.lineHeightPt;
        this.filmLineReservePt = b.filmLineReservePt;
    }

    public static SheetSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.dpi = dpi;
        b.marginMm = marginMm;
        b.footerBandMm = footerBandMm;
        b.unifiedGapMm = unifiedGapMm;
        b.minCellWidthMm = minCellWidthMm;
        b.pageWidthBasisMm = pageWidthBasisMm;
        b.maxPageWidthMm = maxPageWidthMm;
        b.maxPageHeightMm = maxPageHeightMm;
        b.cellGapPx = cellGapPx;
        b.separatorPx = separatorPx;
        b.ratioWidth = ratioWidth;
        b.ratioHeight = ratioHeight;
        b.bodyFontPt = bodyFontPt;
        b.filmFontPt = filmFontPt;
        b.lineHeightPt = lineHeightPt;
        b.filmLineReservePt = filmLineReservePt;
        return b;
    }

    public int mmToPixels(double mm) {
        return (int) Math.round(mm * dpi / MM_PER_INCH);
    }

    public int pointsToPixels(double points) {
        return (int) (points * dpi / POINTS_PER_INCH);
    }

    public int dpi() {
        return dpi;
    }

    public int margin() {
        return mmToPixels(marginMm);
    }

    public int footerBand() {
        return mmToPixels(footerBandMm);
    }

    public int unifiedGap() {
        return mmToPixels(unifiedGapMm);
    }

    public int minCellWidth() {
        return mmToPixels(minCellWidthMm);
    }

    public int pageWidthBasis() {
        return mmToPixels(pageWidthBasisMm);
    }

    public int maxPageWidth() {
        return mmToPixels(maxPageWidthMm);
    }

    public int maxPageHeight() {
        return mmToPixels(maxPageHeightMm);
    }

    public int cellGap() {
        return cellGapPx;
    }

    public int separatorThickness() {
        return separatorPx;
    }

    public int ratioWidth() {
        return ratioWidth;
    }

    public int ratioHeight() {
        return ratioHeight;
    }

    public int bodyFontSize() {
        return pointsToPixels(bodyFontPt);
    }

    public int filmFontSize() {
        return pointsToPixels(filmFontPt);
    }

    public int lineHeight() {
        return pointsToPixels(lineHeightPt);
    }

    public int filmLineReserve() {
        return pointsToPixels(filmLineReservePt);
    }

    @Override
    public String toString() {
        return "SheetSettings{dpi=" + dpi
            + ", margin=" + marginMm + "mm"
            + ", footer=" + footerBandMm + "mm"
            + ", unifiedGap=" + unifiedGapMm + "mm"
            + ", cellGap=" + cellGapPx + "px"
            + ", minCell=" + minCellWidthMm + "mm"
            + ", basis=" + pageWidthBasisMm + "mm"
            + ", max=" + maxPageWidthMm + "x" + maxPageHeightMm + "mm"
            + ", ratio=" + ratioWidth + ":" + ratioHeight + "}";
    }

    public static final class Builder {
        private int dpi = 300;
        private double marginMm = 10;
        private double footerBandMm = 35;
        private double unifiedGapMm = 6;
        private double minCellWidthMm = 30;
        private double pageWidthBasisMm = 210;
        private double maxPageWidthMm = 210;
        private double maxPageHeightMm = 297;
        private int cellGapPx = 10;
        private int separatorPx = 2;
        private int ratioWidth = 4;
        private int ratioHeight = 5;
        private double bodyFontPt = 14;
        private double filmFontPt = 16;
        private double lineHeightPt = 18;
        private double filmLineReservePt = 20;

        private Builder() {
        }

        public Builder dpi(int dpi) {
            this.dpi = dpi;
            return this;
        }

        public Builder marginMm(double marginMm) {
            this.marginMm = marginMm;
            return this;
        }

        public Builder footerBandMm(double footerBandMm) {
            this.footerBandMm = footerBandMm;
            return this;
        }

        public Builder unifiedGapMm(double unifiedGapMm) {
            this.unifiedGapMm = unifiedGapMm;
            return this;
        }

        public Builder minCellWidthMm(double minCellWidthMm) {
            this.minCellWidthMm = minCellWidthMm;
            return this;
        }

        public Builder pageWidthBasisMm(double pageWidthBasisMm) {
            this.pageWidthBasisMm = pageWidthBasisMm;
            return this;
        }

        public Builder maxPageMm(double widthMm, double heightMm) {
            this.maxPageWidthMm = widthMm;
            this.maxPageHeightMm = heightMm;
            return this;
        }

        public Builder cellGapPx(int cellGapPx) {
            this.cellGapPx = cellGapPx;
            return this;
        }

        public Builder separatorPx(int separatorPx) {
            this.separatorPx = separatorPx;
            return this;
        }

        public Builder targetRatio(int width, int height) {
            this.ratioWidth = width;
            this.ratioHeight = height;
            return this;
        }

        public Builder fontSizesPt(double body, double film, double lineHeight, double filmLineReserve) {
            this.bodyFontPt = body;
            this.filmFontPt = film;
            this.lineHeightPt = lineHeight;
            this.filmLineReservePt = filmLineReserve;
            return this;
        }

        public SheetSettings build() {
            if (dpi <= 0) {
                throw new IllegalArgumentException("dpi must be positive");
            }
            if (ratioWidth <= 0 || ratioHeight <= 0) {
                throw new IllegalArgumentException("Target ratio must be positive");
            }
            if (marginMm < 0 || footerBandMm < 0 || unifiedGapMm < 0 || cellGapPx < 0 || separatorPx < 0) {
                throw new IllegalArgumentException("Margins and gaps must not be negative");
            }
            if (pageWidthBasisMm <= 0 || maxPageWidthMm <= 0 || maxPageHeightMm <= 0) {
                throw new IllegalArgumentException("Page sizes must be positive");
            }
            return new SheetSettings(this);
        }
    }
}
