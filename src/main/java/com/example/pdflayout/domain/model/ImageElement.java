package com.example.pdflayout.domain.model;

/**
 * Raster image placed on a page.
 * {@code src} carries the encoded image bytes as a data URI or bare base64 string, {@code x}/{@code y}
 * locate the top-left corner and {@code width}/{@code height} describe the placed footprint in points,
 * not the natural pixel size.
 */
public record ImageElement(
        String src,
        double x,
        double y,
        double width,
        double height
) implements LayoutElement {
}
