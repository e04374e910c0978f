package com.filmtools.contactsheet.core.export;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Any failure while writing a sheet to disk.
 */
public final class SheetExportException extends IOException {
    private final Path target;

    public SheetExportException(Path target, String message, Throwable cause) {
        super("Failed to export " + target + ": " + message, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
