package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.logging.AppLogger;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.GraphicsEnvironment;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers custom font files and picks the sans-serif family sheets are lettered with.
 */
public final class FontRegistry {
    private static final Logger LOGGER = AppLogger.get();

    /** Preferred families, best first. {@link Font#SANS_SERIF} is always available as a fallback. */
    static final List<String> PREFERRED_FAMILIES = List.of(
        "Helvetica Neue", "Helvetica", "Arial", "Liberation Sans", "DejaVu Sans", "Noto Sans"
    );

    private FontRegistry() { }

    /**
     * Loads and registers all supported font files in the given directory.
     * Supports .ttf, .otf, .ttc.
     *
     * @param fontFolderPath path to a directory containing font files
     * @return number of fonts successfully registered (file-level count)
     * @throws IOException if the directory is missing/invalid or nothing could be loaded
     */
    public static int loadFontsFromDirectory(String fontFolderPath) throws IOException {
        File fontDir = new File(fontFolderPath);
        if (!fontDir.isDirectory()) {
            throw new IOException("Font folder not found or is not a directory: " + fontFolderPath);
        }

        File[] fontFiles = fontDir.listFiles((dir, name) -> {
            String lowercase = name.toLowerCase(Locale.ROOT);
            return lowercase.endsWith(".ttf") || lowercase.endsWith(".otf") || lowercase.endsWith(".ttc");
        });

        if (fontFiles == null || fontFiles.length == 0) {
            throw new IOException("No font files (.ttf, .otf, .ttc) were found in: " + fontFolderPath);
        }

        int loadedCount = 0;
        for (File fontFile : fontFiles) {
            try {
                loadedCount += loadFontFile(fontFile);
            } catch (IOException | FontFormatException e) {
                LOGGER.log(Level.FINE, "Skipping unreadable font " + fontFile.getName() + ": " + e.getMessage());
            }
        }

        if (loadedCount == 0) {
            throw new IOException("Font files were found but none could be registered in: " + fontFolderPath);
        }
        LOGGER.fine("Registered " + loadedCount + " font file(s) from " + fontFolderPath);
        return loadedCount;
    }

    static int loadFontFile(File fontFile) throws IOException, FontFormatException {
        if (!fontFile.isFile()) {
            throw new IOException("Font file not found: " + fontFile);
        }
        Font font = Font.createFont(Font.TRUETYPE_FONT, fontFile);
        return GraphicsEnvironment.getLocalGraphicsEnvironment().registerFont(font) ? 1 : 0;
    }

    /**
     * Returns the first installed family from {@link #PREFERRED_FAMILIES}, or the logical
     * {@code SansSerif} family when none is installed.
     */
    public static String resolveSansSerifFamily() {
        Set<String> installed = new HashSet<>();
        try {
            String[] names = GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames(Locale.ROOT);
            installed.addAll(Arrays.asList(names));
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Font enumeration failed, using logical sans-serif: " + e.getMessage());
        }
        return pickFamily(installed);
    }

    static String pickFamily(Set<String> installed) {
        for (String family : PREFERRED_FAMILIES) {
            if (installed.contains(family)) {
                return family;
            }
        }
        return Font.SANS_SERIF;
    }

    public static Font sansSerif(int style, int pixelSize) {
        return new Font(resolveSansSerifFamily(), style, pixelSize);
    }
}
