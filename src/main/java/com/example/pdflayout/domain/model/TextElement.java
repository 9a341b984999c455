package com.example.pdflayout.domain.model;

/**
 * Text run positioned at its baseline origin.
 * {@code y} is the canonical distance from the top edge of the page to the baseline.
 */
public record TextElement(
        String text,
        double x,
        double y,
        double fontSize,
        double width,
        double height,
        String fontName,
        RgbColor color
) implements LayoutElement {

    public TextElement {
        if (color == null) {
            color = RgbColor.BLACK;
        }
    }
}
