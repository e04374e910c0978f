package com.filmtools.contactsheet.session;

import com.filmtools.contactsheet.core.export.ExportFormat;
import com.filmtools.contactsheet.core.export.SheetExporter;
import com.filmtools.contactsheet.core.format.FormatCatalog;
import com.filmtools.contactsheet.core.format.FormatSpec;
import com.filmtools.contactsheet.core.image.ImageLoader;
import com.filmtools.contactsheet.core.image.OrientationPolicy;
import com.filmtools.contactsheet.core.layout.LayoutPlan;
import com.filmtools.contactsheet.core.model.MetadataField;
import com.filmtools.contactsheet.core.model.MetadataInfo;
import com.filmtools.contactsheet.core.model.NumberedThumbnail;
import com.filmtools.contactsheet.core.model.SourceImage;
import com.filmtools.contactsheet.core.render.ContactSheetRenderer;
import com.filmtools.contactsheet.core.render.Sheet;
import com.filmtools.contactsheet.logging.AppLogger;
import com.filmtools.contactsheet.logging.RenderErrorLogger;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * State of one open contact sheet document: the scans, the selected format, the footer
 * metadata and the most recently rendered sheet.
 * <p>
 * Not thread-safe; one render runs at a time.
 */
public final class ContactSheetSession {
    private static final Logger LOGGER = AppLogger.get();

    private final FormatCatalog catalog;
    private final ImageLoader imageLoader;
    private final ContactSheetRenderer renderer;
    private final SheetExporter exporter;

    private final List<Path> images = new ArrayList<>();
    private FormatSpec format;
    private MetadataInfo metadata = MetadataInfo.empty();
    private Sheet currentSheet;
    private boolean unsavedChanges;

    public ContactSheetSession(FormatCatalog catalog,
                               String initialFormatId,
                               ImageLoader imageLoader,
                               ContactSheetRenderer renderer,
                               SheetExporter exporter) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.imageLoader = Objects.requireNonNull(imageLoader, "imageLoader");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.format = catalog.getFormat(initialFormatId);
    }

    /**
     * Adds files or directories; the image list stays sorted by file name and free of duplicates.
     */
    public List<Path> addImages(Collection<Path> paths) throws IOException {
        List<Path> combined = new ArrayList<>(images);
        combined.addAll(paths);
        List<Path> collected = imageLoader.collectImageFiles(combined);
        if (!collected.equals(images)) {
            images.clear();
            images.addAll(collected);
            unsavedChanges = true;
        }
        return images();
    }

    public void clearImages() {
        if (!images.isEmpty()) {
            images.clear();
            unsavedChanges = true;
        }
    }

    public List<Path> images() {
        return List.copyOf(images);
    }

    public FormatSpec format() {
        return format;
    }

    public void selectFormat(String formatId) {
        FormatSpec selected = catalog.getFormat(formatId);
        if (!selected.equals(format)) {
            format = selected;
            unsavedChanges = true;
        }
    }

    public MetadataInfo metadata() {
        return metadata;
    }

    public void setMetadata(MetadataField field, String value) {
        MetadataInfo updated = metadata.with(field, value);
        if (!updated.equals(metadata)) {
            metadata = updated;
            unsavedChanges = true;
        }
    }

    public void setMetadata(MetadataInfo info) {
        MetadataInfo updated = info == null ? MetadataInfo.empty() : info;
        if (!updated.equals(metadata)) {
            metadata = updated;
            unsavedChanges = true;
        }
    }

    public boolean hasUnsavedChanges() {
        return unsavedChanges;
    }

    public Optional<Sheet> currentSheet() {
        return Optional.ofNullable(currentSheet);
    }

    /**
     * Decodes the scans, applies the format's rotation policy, numbers them in list order and
     * composites a new sheet, replacing the previous one.
     */
    public Sheet render() throws IOException {
        if (images.isEmpty()) {
            throw new IllegalStateException("Add images before rendering a contact sheet.");
        }
        format.maxImageCount().ifPresent(max -> {
            if (images.size() > max) {
                LOGGER.warning("%d images exceed the %d frames of %s; all images are kept.".formatted(
                    images.size(), max, format.displayName()));
            }
        });

        List<NumberedThumbnail> numbered;
        try {
            numbered = prepareThumbnails(renderer.plan(images.size(), format));
        } catch (IOException e) {
            RenderErrorLogger.logFailure("render", format.id(), images.size(), null, e);
            throw e;
        }

        currentSheet = renderer.render(numbered, format, metadata);
        unsavedChanges = false;
        return currentSheet;
    }

    /**
     * Decodes, orients and shrinks one scan at a time; only cell-sized bitmaps are kept.
     */
    List<NumberedThumbnail> prepareThumbnails(LayoutPlan plan) throws IOException {
        List<NumberedThumbnail> numbered = new ArrayList<>(images.size());
        int sequence = 1;
        for (Path path : images) {
            SourceImage source = imageLoader.load(path);
            BufferedImage oriented = OrientationPolicy.apply(source.image(), format);
            numbered.add(new NumberedThumbnail(renderer.fitToCell(oriented, plan), sequence++));
        }
        return numbered;
    }

    /**
     * Downscaled copy of the current sheet for on-screen display.
     */
    public BufferedImage preview(int width) {
        if (currentSheet == null) {
            throw new IllegalStateException("No sheet has been rendered yet.");
        }
        if (width <= 0) {
            throw new IllegalArgumentException("Preview width must be positive: " + width);
        }
        BufferedImage source = currentSheet.image();
        int height = Math.max(1, (int) ((long) width * source.getHeight() / source.getWidth()));
        BufferedImage preview = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = preview.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return preview;
    }

    /**
     * Exports the current sheet, re-rendering first when anything changed since the last render.
     */
    public Path export(Path target, ExportFormat exportFormat) throws IOException {
        if (currentSheet == null || unsavedChanges) {
            render();
        }
        return exporter.write(exportFormat, List.of(currentSheet), target);
    }
}
