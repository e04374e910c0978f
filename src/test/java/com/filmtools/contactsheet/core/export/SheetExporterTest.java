package com.filmtools.contactsheet.core.export;

import com.filmtools.contactsheet.core.format.FormatCatalog;
import com.filmtools.contactsheet.core.layout.SheetSettings;
import com.filmtools.contactsheet.core.model.MetadataInfo;
import com.filmtools.contactsheet.core.model.NumberedThumbnail;
import com.filmtools.contactsheet.core.render.ContactSheetRenderer;
import com.filmtools.contactsheet.core.render.Sheet;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SheetExporterTest {

    private static final String ERROR_LOG_PROPERTY = "contactsheet.errorLog";

    @TempDir
    Path tempDir;

    private final SheetExporter exporter = new SheetExporter();
    private String previousErrorLog;

    @BeforeEach
    void redirectErrorLog() {
        previousErrorLog = System.getProperty(ERROR_LOG_PROPERTY);
        System.setProperty(ERROR_LOG_PROPERTY, tempDir.resolve("errors.csv").toString());
    }

    @AfterEach
    void restoreErrorLog() {
        if (previousErrorLog == null) {
            System.clearProperty(ERROR_LOG_PROPERTY);
        } else {
            System.setProperty(ERROR_LOG_PROPERTY, previousErrorLog);
        }
    }

    @Test
    void jpegKeepsSizeAndRecordsDpi() throws IOException {
        Sheet sheet = sampleSheet();
        Path target = tempDir.resolve("out/roll-01.jpg");

        Path written = exporter.writeJpeg(sheet, target);

        assertEquals(target.toAbsolutePath(), written);
        BufferedImage decoded = ImageIO.read(written.toFile());
        assertEquals(sheet.width(), decoded.getWidth());
        assertEquals(sheet.height(), decoded.getHeight());
        assertEquals(300, readDpi(written));
    }

    @Test
    void pngIsLosslessAndRecordsDpi() throws IOException {
        Sheet sheet = sampleSheet();
        Path written = exporter.writePng(sheet, tempDir.resolve("roll-01.png"));

        BufferedImage decoded = ImageIO.read(written.toFile());
        assertEquals(sheet.width(), decoded.getWidth());
        assertEquals(sheet.image().getRGB(10, 10), decoded.getRGB(10, 10));
        int cx = sheet.layout().cellAt(0).x() + sheet.layout().plan().cellWidth() / 2;
        int cy = sheet.layout().cellAt(0).y() + sheet.layout().plan().cellHeight() / 2;
        assertEquals(sheet.image().getRGB(cx, cy), decoded.getRGB(cx, cy));
        assertEquals(300, readDpi(written));
    }

    @Test
    void pdfHasOneA4PagePerSheet() throws IOException {
        Sheet sheet = sampleSheet();
        Path written = exporter.writePdf(List.of(sheet, sheet), tempDir.resolve("roll.pdf"));

        try (PDDocument document = PDDocument.load(written.toFile())) {
            assertEquals(2, document.getNumberOfPages());
            PDRectangle media = document.getPage(0).getMediaBox();
            assertEquals(PDRectangle.A4.getWidth(), media.getWidth(), 0.01);
            assertEquals(PDRectangle.A4.getHeight(), media.getHeight(), 0.01);
        }
    }

    @Test
    void sheetWithinPageIsCentredAtNativeSize() {
        PdfSheetWriter.Placement placement = PdfSheetWriter.place(2476, 3095, 300, PDRectangle.A4);

        assertEquals(1f, placement.scale(), 0.0001);
        assertEquals(2476 * 72f / 300, placement.width(), 0.01);
        assertEquals((PDRectangle.A4.getWidth() - placement.width()) / 2, placement.x(), 0.01);
        assertEquals((PDRectangle.A4.getHeight() - placement.height()) / 2, placement.y(), 0.01);
    }

    @Test
    void oversizedSheetIsScaledDownToFitPage() {
        PdfSheetWriter.Placement placement = PdfSheetWriter.place(4000, 6000, 300, PDRectangle.A4);

        assertTrue(placement.scale() < 1f);
        assertTrue(placement.width() <= PDRectangle.A4.getWidth() + 0.01);
        assertEquals(PDRectangle.A4.getHeight(), placement.height(), 0.01);
        assertEquals(0f, placement.y(), 0.01);
    }

    @Test
    void writeDispatchesOnFormat() throws IOException {
        Sheet sheet = sampleSheet();

        Path png = exporter.write(ExportFormat.PNG, List.of(sheet), tempDir.resolve("a.png"));
        Path pdf = exporter.write(ExportFormat.PDF, List.of(sheet), tempDir.resolve("a.pdf"));

        assertTrue(Files.size(png) > 0);
        assertTrue(Files.size(pdf) > 0);
        assertThrows(IllegalArgumentException.class,
            () -> exporter.write(ExportFormat.JPEG, List.of(sheet, sheet), tempDir.resolve("b.jpg")));
        assertThrows(IllegalArgumentException.class,
            () -> exporter.writePdf(List.of(), tempDir.resolve("empty.pdf")));
    }

    @Test
    void failedExportLeavesNoFileAndIsLogged() throws IOException {
        Sheet sheet = sampleSheet();
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "plain file");
        Path target = blocker.resolve("sheet.jpg");

        SheetExportException ex = assertThrows(SheetExportException.class, () -> exporter.writeJpeg(sheet, target));

        assertEquals(target.toAbsolutePath(), ex.getTarget());
        assertFalse(Files.exists(target));
        List<String> rows = Files.readAllLines(tempDir.resolve("errors.csv"));
        assertEquals(2, rows.size());
        assertTrue(rows.get(1).contains("export-jpeg"));
    }

    @Test
    void failedMoveRemovesTemporaryFile() throws IOException {
        Sheet sheet = sampleSheet();
        Path occupied = Files.createDirectories(tempDir.resolve("occupied.png"));
        Files.writeString(occupied.resolve("keep.txt"), "x");

        assertThrows(SheetExportException.class, () -> exporter.writePng(sheet, occupied));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".part")));
        }
        assertTrue(Files.isDirectory(occupied));
    }

    static Sheet sampleSheet() {
        BufferedImage frame = new BufferedImage(300, 200, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = frame.createGraphics();
        try {
            g.setColor(new Color(40, 120, 200));
            g.fillRect(0, 0, 300, 200);
        } finally {
            g.dispose();
        }
        ContactSheetRenderer renderer = new ContactSheetRenderer(FormatCatalog.defaultCatalog(), SheetSettings.defaults());
        return renderer.render(List.of(new NumberedThumbnail(frame, 1)), "35mm-full",
            MetadataInfo.fromMap(Map.of("film", "Portra 400")));
    }

    static int readDpi(Path file) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            assertTrue(readers.hasNext());
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                IIOMetadata metadata = reader.getImageMetadata(0);
                Node root = metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
                Node pixelSize = find(root, "HorizontalPixelSize");
                assertNotNull(pixelSize, "No physical pixel size recorded");
                NamedNodeMap attributes = pixelSize.getAttributes();
                double mmPerPixel = Double.parseDouble(attributes.getNamedItem("value").getNodeValue());
                return (int) Math.round(25.4 / mmPerPixel);
            } finally {
                reader.dispose();
            }
        }
    }

    private static Node find(Node node, String name) {
        if (name.equals(node.getNodeName())) {
            return node;
        }
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            Node found = find(child, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
