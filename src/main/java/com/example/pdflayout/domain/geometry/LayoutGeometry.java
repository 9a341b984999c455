package com.example.pdflayout.domain.geometry;

/**
 * Coordinate conversions shared by extraction and reconstruction.
 * <p>
 * PDF user space has its origin at the bottom-left with y growing upwards. The intermediate layout uses a
 * top-left origin with y growing downwards. Transforms follow the PDF convention
 * {@code [a b c d e f]}, where {@code [a b; c d]} is the linear part and {@code (e, f)} the translation.
 */
public final class LayoutGeometry {

    public static final double[] IDENTITY = {1, 0, 0, 1, 0, 0};

    private LayoutGeometry() {
    }

    /**
     * Decomposes a transform into a canonical origin and axis scale factors.
     * Malformed input (wrong length, non-finite entries, a zero-length axis) yields
     * {@link Placement#fallback()} at {@code (0, 0)} instead of failing.
     *
     * @param transform  six element affine transform
     * @param pageHeight height of the page the transform lives on
     * @return placement in canonical coordinates
     */
    public static Placement matrixToOrigin(double[] transform, double pageHeight) {
        if (transform == null || transform.length != 6 || !Double.isFinite(pageHeight)) {
            return Placement.FALLBACK;
        }
        for (double value : transform) {
            if (!Double.isFinite(value)) {
                return Placement.FALLBACK;
            }
        }
        double scaleX = Math.hypot(transform[0], transform[1]);
        double scaleY = Math.hypot(transform[2], transform[3]);
        if (scaleX == 0 || scaleY == 0) {
            return Placement.FALLBACK;
        }
        return new Placement(transform[4], toCanonicalY(transform[5], pageHeight), scaleX, scaleY, false);
    }

    /**
     * Maps the unit square through a transform and returns the canonical bounding box of the result.
     * This is the placed footprint of an image whatever the sign of its axes or a quarter-turn rotation.
     * Input that {@link #matrixToOrigin(double[], double)} rejects yields {@link Footprint#fallback()}.
     *
     * @param transform  six element affine transform
     * @param pageHeight height of the page the transform lives on
     * @return footprint in canonical coordinates
     */
    public static Footprint unitSquareFootprint(double[] transform, double pageHeight) {
        if (matrixToOrigin(transform, pageHeight).fallback()) {
            return Footprint.FALLBACK;
        }
        double a = transform[0];
        double b = transform[1];
        double c = transform[2];
        double d = transform[3];
        double e = transform[4];
        double f = transform[5];
        double[] xs = {e, a + e, c + e, a + c + e};
        double[] ys = {f, b + f, d + f, b + d + f};
        double minX = Math.min(Math.min(xs[0], xs[1]), Math.min(xs[2], xs[3]));
        double maxX = Math.max(Math.max(xs[0], xs[1]), Math.max(xs[2], xs[3]));
        double minY = Math.min(Math.min(ys[0], ys[1]), Math.min(ys[2], ys[3]));
        double maxY = Math.max(Math.max(ys[0], ys[1]), Math.max(ys[2], ys[3]));
        return new Footprint(minX, toCanonicalY(maxY, pageHeight), maxX - minX, maxY - minY, false);
    }

    /**
     * @param rawY   y in PDF user space
     * @param height page height
     * @return distance from the top edge of the page
     */
    public static double toCanonicalY(double rawY, double height) {
        return height - rawY;
    }

    /**
     * Inverse of {@link #toCanonicalY(double, double)} for a box whose canonical y is its top edge.
     * Passing an element height of zero maps a point (such as a text baseline) back unchanged.
     *
     * @param canonicalY    distance from the top edge of the page
     * @param height        page height
     * @param elementHeight height of the placed box
     * @return y of the box's bottom edge in PDF user space
     */
    public static double fromCanonicalY(double canonicalY, double height, double elementHeight) {
        return height - canonicalY - elementHeight;
    }
}
