package com.filmtools.contactsheet.core.layout;

/**
 * Final pixel size of a sheet. {@code clamped} is set when the maximum page bounds forced the
 * canvas down, in which case the content may no longer fit.
 */
public record CanvasSize(int width, int height, boolean clamped) {
}
