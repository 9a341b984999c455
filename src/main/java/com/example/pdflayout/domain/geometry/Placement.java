package com.example.pdflayout.domain.geometry;

/**
 * Result of decomposing an affine transform.
 *
 * @param x        horizontal translation in points
 * @param y        canonical (top-left origin) y of the transform origin
 * @param scaleX   length of the transformed x unit vector
 * @param scaleY   length of the transformed y unit vector
 * @param fallback {@code true} when the transform was unusable and identity placement was substituted
 */
public record Placement(double x, double y, double scaleX, double scaleY, boolean fallback) {

    static final Placement FALLBACK = new Placement(0, 0, 1, 1, true);
}
