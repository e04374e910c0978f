package com.filmtools.contactsheet.core.format;

/**
 * Raised when a format id is not present in the {@link FormatCatalog}.
 */
public final class UnknownFormatException extends IllegalArgumentException {
    private final String formatId;

    public UnknownFormatException(String formatId) {
        super("Unknown film format: " + formatId);
        this.formatId = formatId;
    }

    public String getFormatId() {
        return formatId;
    }
}
