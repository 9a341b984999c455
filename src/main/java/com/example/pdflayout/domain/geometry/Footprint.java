package com.example.pdflayout.domain.geometry;

/**
 * Axis-aligned box covered by a transformed unit square, in canonical coordinates.
 *
 * @param x        left edge in points
 * @param y        top edge, measured from the top of the page
 * @param width    horizontal extent in points
 * @param height   vertical extent in points
 * @param fallback {@code true} when the transform was unusable and no box could be derived
 */
public record Footprint(double x, double y, double width, double height, boolean fallback) {

    static final Footprint FALLBACK = new Footprint(0, 0, 0, 0, true);
}
