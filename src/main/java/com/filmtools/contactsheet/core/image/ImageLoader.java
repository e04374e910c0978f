package com.filmtools.contactsheet.core.image;

import com.filmtools.contactsheet.core.model.SourceImage;
import com.filmtools.contactsheet.logging.AppLogger;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Finds scan files and decodes them into RGB images.
 */
public final class ImageLoader {
    private static final Logger LOGGER = AppLogger.get();
    private static final String[] IMAGE_EXTENSIONS = {".jpg", ".jpeg", ".png", ".tiff", ".tif", ".bmp"};

    /**
     * Expands directories recursively, drops non-image files and duplicates, and sorts the
     * result by file name. The order of the returned list is the frame numbering order.
     */
    public List<Path> collectImageFiles(Collection<Path> inputs) throws IOException {
        Set<Path> unique = new LinkedHashSet<>();
        if (inputs != null) {
            for (Path input : inputs) {
                if (input == null) {
                    continue;
                }
                Path normalized = input.toAbsolutePath().normalize();
                if (Files.isDirectory(normalized)) {
                    try (Stream<Path> stream = Files.walk(normalized)) {
                        stream.filter(Files::isRegularFile)
                            .filter(ImageLoader::isImageFile)
                            .sorted()
                            .forEach(unique::add);
                    }
                } else if (Files.isRegularFile(normalized) && isImageFile(normalized)) {
                    unique.add(normalized);
                } else {
                    LOGGER.fine(() -> "Skipping non-image input " + normalized);
                }
            }
        }
        List<Path> sorted = new ArrayList<>(unique);
        sorted.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return sorted;
    }

    public static boolean isImageFile(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : IMAGE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    public SourceImage load(Path path) throws InvalidImageException {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new InvalidImageException(path, e);
        }
        if (decoded == null) {
            throw new InvalidImageException(path, "no ImageIO reader accepts this file");
        }
        return new SourceImage(path, toRgb(decoded));
    }

    static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
