package com.filmtools.contactsheet.config;

import com.filmtools.contactsheet.core.layout.SheetSettings;
import com.filmtools.contactsheet.logging.AppLogger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values.
 * <p>
 * System properties win over persisted preferences, which win over built-in defaults.
 * Sheet geometry overrides use the {@code contactsheet.*} property names below; values that
 * cannot be parsed are ignored with a warning.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String FONT_DIR_PROPERTY = "contactsheet.fontDir";
    static final String DEFAULT_FORMAT_PROPERTY = "contactsheet.format";
    static final String DEFAULT_FORMAT_ID = "35mm-full";

    static final String PREF_KEY_FONT_DIR = "font.dir";
    static final String PREF_KEY_FORMAT = "format.last";
    static final String PREF_KEY_OUTPUT_DIR = "output.dir";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global(), System.getProperties());

    private final PreferencesStore preferences;
    private final Properties properties;

    ConfigService(PreferencesStore preferences, Properties properties) {
        this.preferences = preferences;
        this.properties = properties;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public Optional<Path> getFontDirectory() {
        String override = properties.getProperty(FONT_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Optional.of(Paths.get(override.trim()));
        }
        return preferences.getPath(PREF_KEY_FONT_DIR);
    }

    public void setFontDirectory(Path fontDirectory) {
        preferences.putPath(PREF_KEY_FONT_DIR, fontDirectory);
    }

    public String getDefaultFormatId() {
        String override = properties.getProperty(DEFAULT_FORMAT_PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return preferences.getString(PREF_KEY_FORMAT).orElse(DEFAULT_FORMAT_ID);
    }

    public void rememberFormat(String formatId) {
        preferences.putString(PREF_KEY_FORMAT, formatId);
    }

    public Path getOutputDirectory() {
        return preferences.getPath(PREF_KEY_OUTPUT_DIR)
            .orElse(Paths.get(System.getProperty("user.home")));
    }

    public void rememberOutputDirectory(Path directory) {
        preferences.putPath(PREF_KEY_OUTPUT_DIR, directory);
    }

    /**
     * Default sheet geometry with any {@code contactsheet.*} overrides applied.
     */
    public SheetSettings getSheetSettings() {
        SheetSettings defaults = SheetSettings.defaults();
        SheetSettings.Builder builder = defaults.toBuilder();
        applyInt("contactsheet.dpi", builder::dpi);
        applyDouble("contactsheet.marginMm", builder::marginMm);
        applyDouble("contactsheet.footerMm", builder::footerBandMm);
        applyDouble("contactsheet.unifiedGapMm", builder::unifiedGapMm);
        applyDouble("contactsheet.minCellMm", builder::minCellWidthMm);
        applyDouble("contactsheet.pageWidthMm", builder::pageWidthBasisMm);
        applyInt("contactsheet.cellGapPx", builder::cellGapPx);
        return builder.build();
    }

    private void applyInt(String key, Consumer<Integer> setter) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            LOGGER.warning("Ignoring invalid value for " + key + ": " + raw);
        }
    }

    private void applyDouble(String key, Consumer<Double> setter) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            setter.accept(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            LOGGER.warning("Ignoring invalid value for " + key + ": " + raw);
        }
    }
}
