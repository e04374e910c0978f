package com.filmtools.contactsheet.core.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a scan cannot be decoded into an image.
 */
public final class InvalidImageException extends IOException {
    private final Path path;

    public InvalidImageException(Path path, String reason) {
        super("Cannot decode image " + path + ": " + reason);
        this.path = path;
    }

    public InvalidImageException(Path path, Throwable cause) {
        super("Cannot decode image " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
