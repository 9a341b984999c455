package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.model.RgbColor;

/**
 * Glyph run produced by one text-showing operator, still in PDF user space.
 *
 * @param text      unicode text of the run
 * @param transform text rendering matrix of the first glyph as {@code [a b c d e f]}
 * @param width     advance width of the run
 * @param height    tallest glyph height of the run
 * @param fontName  PDF font name, may be {@code null}
 * @param color     fill colour active when the run was shown
 */
public record TextRun(String text, double[] transform, double width, double height, String fontName, RgbColor color) {
}
