package com.filmtools.contactsheet.session;

import com.filmtools.contactsheet.core.export.ExportFormat;
import com.filmtools.contactsheet.core.export.SheetExporter;
import com.filmtools.contactsheet.core.format.FormatCatalog;
import com.filmtools.contactsheet.core.format.UnknownFormatException;
import com.filmtools.contactsheet.core.image.ImageLoader;
import com.filmtools.contactsheet.core.image.InvalidImageException;
import com.filmtools.contactsheet.core.layout.LayoutPlan;
import com.filmtools.contactsheet.core.layout.SheetSettings;
import com.filmtools.contactsheet.core.model.MetadataField;
import com.filmtools.contactsheet.core.model.MetadataInfo;
import com.filmtools.contactsheet.core.model.NumberedThumbnail;
import com.filmtools.contactsheet.core.render.ContactSheetRenderer;
import com.filmtools.contactsheet.core.render.Sheet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContactSheetSessionTest {

    @TempDir
    Path tempDir;

    private ContactSheetRenderer renderer;
    private ContactSheetSession session;

    @BeforeEach
    void setUp() {
        System.setProperty("contactsheet.errorLog", tempDir.resolve("errors.csv").toString());
        FormatCatalog catalog = FormatCatalog.defaultCatalog();
        renderer = new ContactSheetRenderer(catalog, SheetSettings.defaults());
        session = new ContactSheetSession(catalog, "35mm-full", new ImageLoader(), renderer, new SheetExporter());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("contactsheet.errorLog");
    }

    @Test
    void addingImagesKeepsSortedUniqueListAndMarksChanges() throws IOException {
        Path b = scan("b.png", 60, 40, Color.RED);
        Path a = scan("a.png", 60, 40, Color.GREEN);

        session.addImages(List.of(b));
        session.addImages(List.of(a, b));

        assertEquals(List.of(a.toAbsolutePath().normalize(), b.toAbsolutePath().normalize()), session.images());
        assertTrue(session.hasUnsavedChanges());

        session.clearImages();
        assertTrue(session.images().isEmpty());
    }

    @Test
    void renderingWithoutImagesIsRejected() {
        assertThrows(IllegalStateException.class, () -> session.render());
        assertThrows(IllegalStateException.class, () -> session.preview(200));
    }

    @Test
    void renderNumbersFramesInFileOrderAndRotatesPortraitScans() throws IOException {
        scan("01.png", 40, 60, Color.RED);
        scan("02.png", 60, 40, Color.BLUE);
        session.addImages(List.of(tempDir));

        Sheet sheet = session.render();

        assertFalse(session.hasUnsavedChanges());
        assertSame(sheet, session.currentSheet().orElseThrow());
        LayoutPlan plan = sheet.layout().plan();
        assertEquals(1, plan.rowsNeeded());
        LayoutPlan.CellPosition first = sheet.layout().cellAt(0);
        int cx = first.x() + plan.cellWidth() / 2;
        int cy = first.y() + plan.cellHeight() / 2;
        assertEquals(Color.RED.getRGB(), sheet.image().getRGB(cx, cy));
        // rotated 60x40 frame: 30px either side of centre is still inside the picture
        assertEquals(Color.RED.getRGB(), sheet.image().getRGB(cx + 25, cy));
        assertEquals(Color.BLACK.getRGB(), sheet.image().getRGB(cx, cy + 25));
    }

    @Test
    void moreImagesThanFramesAreStillRendered() throws IOException {
        session.selectFormat("120-6x9");
        for (int i = 0; i < 10; i++) {
            scan(String.format("frame-%02d.png", i), 90, 60, Color.GRAY);
        }
        session.addImages(List.of(tempDir));

        Sheet sheet = session.render();

        assertEquals(4, sheet.layout().plan().rowsNeeded());
    }

    @Test
    void scansAreShrunkToCellSizeBeforeCompositing() throws IOException {
        for (int i = 0; i < 6; i++) {
            scan(String.format("big-%02d.png", i), 1500, 1000, Color.DARK_GRAY);
        }
        scan("tall.png", 1000, 1500, Color.DARK_GRAY);
        session.addImages(List.of(tempDir));
        LayoutPlan plan = renderer.plan(session.images().size(), session.format());

        List<NumberedThumbnail> thumbnails = session.prepareThumbnails(plan);

        assertEquals(7, thumbnails.size());
        for (NumberedThumbnail thumbnail : thumbnails) {
            assertTrue(thumbnail.image().getWidth() <= plan.cellWidth());
            assertTrue(thumbnail.image().getHeight() <= plan.cellHeight());
        }
        assertEquals(7, thumbnails.get(6).sequence());
    }

    @Test
    void metadataChangesMarkSessionDirtyOnlyWhenValueChanges() throws IOException {
        scan("a.png", 60, 40, Color.GREEN);
        session.addImages(List.of(tempDir));
        session.render();

        session.setMetadata(MetadataField.FILM, null);
        assertFalse(session.hasUnsavedChanges());

        session.setMetadata(MetadataField.FILM, "Portra 160");
        assertTrue(session.hasUnsavedChanges());
        assertEquals("Portra 160", session.metadata().get(MetadataField.FILM).orElseThrow());

        session.render();
        session.setMetadata(MetadataInfo.fromMap(Map.of("film", "Portra 160")));
        assertFalse(session.hasUnsavedChanges());
    }

    @Test
    void unknownFormatLeavesSelectionUntouched() {
        assertThrows(UnknownFormatException.class, () -> session.selectFormat("aps-c"));
        assertEquals("35mm-full", session.format().id());
        assertFalse(session.hasUnsavedChanges());
    }

    @Test
    void previewKeepsSheetProportions() throws IOException {
        scan("a.png", 60, 40, Color.GREEN);
        session.addImages(List.of(tempDir));
        Sheet sheet = session.render();

        BufferedImage preview = session.preview(400);

        assertEquals(400, preview.getWidth());
        assertEquals(400 * sheet.height() / sheet.width(), preview.getHeight());
        assertThrows(IllegalArgumentException.class, () -> session.preview(0));
    }

    @Test
    void exportRendersPendingChangesFirst() throws IOException {
        scan("a.png", 60, 40, Color.GREEN);
        session.addImages(List.of(tempDir));
        session.render();
        session.selectFormat("120-6x6");

        Path written = session.export(tempDir.resolve("out/sheet.png"), ExportFormat.PNG);

        assertFalse(session.hasUnsavedChanges());
        assertEquals("120-6x6", session.format().id());
        BufferedImage decoded = ImageIO.read(written.toFile());
        assertEquals(session.currentSheet().orElseThrow().width(), decoded.getWidth());
        assertEquals(741, session.currentSheet().orElseThrow().layout().plan().cellWidth());
    }

    @Test
    void undecodableScanFailsRenderAndKeepsPreviousSheet() throws IOException {
        scan("a.png", 60, 40, Color.GREEN);
        session.addImages(List.of(tempDir));
        Sheet previous = session.render();
        Files.writeString(tempDir.resolve("b.jpg"), "broken");
        session.addImages(List.of(tempDir.resolve("b.jpg")));

        assertThrows(InvalidImageException.class, () -> session.render());
        assertSame(previous, session.currentSheet().orElseThrow());
        assertTrue(session.hasUnsavedChanges());
        assertTrue(Files.exists(tempDir.resolve("errors.csv")));
    }

    private Path scan(String name, int width, int height, Color color) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        Path file = tempDir.resolve(name);
        ImageIO.write(image, "png", file.toFile());
        return file;
    }
}
