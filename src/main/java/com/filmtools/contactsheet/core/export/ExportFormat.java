package com.filmtools.contactsheet.core.export;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Output encodings a sheet can be exported to.
 */
public enum ExportFormat {
    JPEG("jpg", "jpeg"),
    PNG("png"),
    PDF("pdf");

    private final String[] extensions;

    ExportFormat(String... extensions) {
        this.extensions = extensions;
    }

    public String defaultExtension() {
        return extensions[0];
    }

    public static Optional<ExportFormat> fromFileName(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String ext = name.substring(dot + 1);
        for (ExportFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(ext)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Export format is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return format;
            }
            for (String candidate : format.extensions) {
                if (candidate.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + value);
    }
}
