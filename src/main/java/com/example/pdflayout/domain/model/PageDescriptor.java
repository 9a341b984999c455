package com.example.pdflayout.domain.model;

import java.util.List;

/**
 * Geometry and ordered element list of a single page.
 * Element order is extraction order and, on reconstruction, the input to the paint-order policy.
 * Width and height are the unrotated page box; {@code rotation} is snapped to 0, 90, 180 or 270.
 */
public record PageDescriptor(
        double width,
        double height,
        int rotation,
        List<LayoutElement> elements
) {

    public PageDescriptor {
        elements = elements == null ? List.of() : elements;
        rotation = normalizeRotation(rotation);
    }

    private static int normalizeRotation(int rotation) {
        int normalized = ((rotation % 360) + 360) % 360;
        return normalized - normalized % 90;
    }
}
