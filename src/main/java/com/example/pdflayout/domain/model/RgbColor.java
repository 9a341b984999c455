package com.example.pdflayout.domain.model;

/**
 * RGB approximation of a fill colour, each channel in the range 0..1.
 */
public record RgbColor(double r, double g, double b) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);

    /**
     * Builds a colour from PDFBox style float components, falling back to black for anything that is
     * not a three channel value.
     *
     * @param components RGB components
     * @return clamped colour
     */
    public static RgbColor of(float[] components) {
        if (components == null || components.length < 3) {
            return BLACK;
        }
        return new RgbColor(components[0], components[1], components[2]).clamped();
    }

    /**
     * @return copy with each channel forced into 0..1, non-finite channels become 0
     */
    public RgbColor clamped() {
        return new RgbColor(clamp(r), clamp(g), clamp(b));
    }

    private static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }
}
