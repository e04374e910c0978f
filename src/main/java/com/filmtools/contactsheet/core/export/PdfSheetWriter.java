package com.filmtools.contactsheet.core.export;

import com.filmtools.contactsheet.core.render.Sheet;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Writes sheets into a PDF, one page per sheet, each scaled down to fit the page and centred.
 */
final class PdfSheetWriter {
    static final float POINTS_PER_INCH = 72f;

    private final PDRectangle pageSize;

    PdfSheetWriter(PDRectangle pageSize) {
        this.pageSize = pageSize;
    }

    void write(List<Sheet> sheets, OutputStream out) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (Sheet sheet : sheets) {
                appendSheetPage(document, sheet);
            }
            document.save(out);
        }
    }

    private void appendSheetPage(PDDocument document, Sheet sheet) throws IOException {
        PDPage page = new PDPage(pageSize);
        document.addPage(page);

        Placement placement = place(sheet.width(), sheet.height(), sheet.dpi(), pageSize);
        PDImageXObject image = LosslessFactory.createFromImage(document, sheet.image());
        try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
            stream.drawImage(image, placement.x(), placement.y(), placement.width(), placement.height());
        }
    }

    /**
     * Sheet size in points scaled by {@code min(pageW/sheetW, pageH/sheetH, 1)} and centred on the page.
     */
    static Placement place(int widthPx, int heightPx, int dpi, PDRectangle page) {
        float sheetWidth = widthPx * POINTS_PER_INCH / dpi;
        float sheetHeight = heightPx * POINTS_PER_INCH / dpi;
        float scale = Math.min(1f, Math.min(page.getWidth() / sheetWidth, page.getHeight() / sheetHeight));
        float width = sheetWidth * scale;
        float height = sheetHeight * scale;
        float x = (page.getWidth() - width) / 2f;
        float y = (page.getHeight() - height) / 2f;
        return new Placement(x, y, width, height, scale);
    }

    record Placement(float x, float y, float width, float height, float scale) {
    }
}
