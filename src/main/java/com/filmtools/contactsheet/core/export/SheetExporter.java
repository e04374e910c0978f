package com.filmtools.contactsheet.core.export;

import com.filmtools.contactsheet.core.render.Sheet;
import com.filmtools.contactsheet.logging.AppLogger;
import com.filmtools.contactsheet.logging.RenderErrorLogger;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes composited sheets to JPEG, PNG or PDF.
 * <p>
 * Output is written to a temporary file beside the target and moved into place only after the
 * encoder finished, so a failed export never leaves a file under the requested name.
 */
public final class SheetExporter {
    private static final Logger LOGGER = AppLogger.get();

    private final PdfSheetWriter pdfWriter;

    public SheetExporter() {
        this(PDRectangle.A4);
    }

    public SheetExporter(PDRectangle pdfPageSize) {
        this.pdfWriter = new PdfSheetWriter(Objects.requireNonNull(pdfPageSize, "pdfPageSize"));
    }

    public Path writeJpeg(Sheet sheet, Path target) throws SheetExportException {
        Objects.requireNonNull(sheet, "sheet");
        return writeAtomically(target, List.of(sheet), "jpeg",
            out -> RasterSheetWriter.writeJpeg(sheet.image(), sheet.dpi(), out));
    }

    public Path writePng(Sheet sheet, Path target) throws SheetExportException {
        Objects.requireNonNull(sheet, "sheet");
        return writeAtomically(target, List.of(sheet), "png",
            out -> RasterSheetWriter.writePng(sheet.image(), sheet.dpi(), out));
    }

    public Path writePdf(List<Sheet> sheets, Path target) throws SheetExportException {
        Objects.requireNonNull(sheets, "sheets");
        if (sheets.isEmpty()) {
            throw new IllegalArgumentException("At least one sheet is required for a PDF export.");
        }
        return writeAtomically(target, sheets, "pdf", out -> pdfWriter.write(sheets, out));
    }

    /**
     * Writes {@code sheets} in the given format. Raster formats take exactly one sheet.
     */
    public Path write(ExportFormat format, List<Sheet> sheets, Path target) throws SheetExportException {
        Objects.requireNonNull(format, "format");
        switch (format) {
            case JPEG:
                return writeJpeg(single(sheets, format), target);
            case PNG:
                return writePng(single(sheets, format), target);
            case PDF:
                return writePdf(sheets, target);
            default:
                throw new IllegalArgumentException("Unsupported export format: " + format);
        }
    }

    private static Sheet single(List<Sheet> sheets, ExportFormat format) {
        if (sheets == null || sheets.size() != 1) {
            throw new IllegalArgumentException(format + " export takes exactly one sheet.");
        }
        return sheets.get(0);
    }

    private Path writeAtomically(Path target, List<Sheet> sheets, String stage, Encoder encoder)
            throws SheetExportException {
        Objects.requireNonNull(target, "target");
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".contact-sheet-", ".part");
            try (OutputStream out = Files.newOutputStream(temp)) {
                encoder.encode(out);
            }
            moveIntoPlace(temp, absolute);
            LOGGER.info("Exported " + stage.toUpperCase(Locale.ROOT) + " to " + absolute);
            return absolute;
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            RenderErrorLogger.logFailure("export-" + stage, null, sheets.size(), absolute, e);
            LOGGER.log(Level.SEVERE, "Export to " + absolute + " failed", e);
            throw new SheetExportException(absolute, String.valueOf(e.getMessage()), e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.fine("Could not remove temporary export file " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Encoder {
        void encode(OutputStream out) throws IOException;
    }
}
