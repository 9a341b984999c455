package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.model.RgbColor;

import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColorN;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColorSpace;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceCMYKColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceGrayColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceRGBColor;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.color.PDColor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects one {@link TextRun} per text-showing operator ({@code Tj}, {@code TJ}, {@code '} and {@code "}),
 * in content stream order.
 * Glyphs are not sorted or merged the way {@link PDFTextStripper} normally does for plain text output.
 * Instances are stateful and meant for a single document.
 */
public class TextRunCollector extends PDFTextStripper {

    private static final Logger log = LoggerFactory.getLogger(TextRunCollector.class);

    private final List<TextRun> runs = new ArrayList<>();
    private List<TextPosition> currentGlyphs;
    private RgbColor currentColor = RgbColor.BLACK;

    /**
     * Creates the collector and registers the fill colour operators the plain stripper ignores.
     *
     * @throws IOException propagated from {@link PDFTextStripper}
     */
    public TextRunCollector() throws IOException {
        addOperator(new SetNonStrokingColorSpace(this));
        addOperator(new SetNonStrokingColor(this));
        addOperator(new SetNonStrokingColorN(this));
        addOperator(new SetNonStrokingDeviceGrayColor(this));
        addOperator(new SetNonStrokingDeviceRGBColor(this));
        addOperator(new SetNonStrokingDeviceCMYKColor(this));
    }

    /**
     * Runs the content stream of a single page and returns its text runs.
     *
     * @param document  loaded document
     * @param pageIndex zero-based page index
     * @return runs in the order they are shown
     * @throws IOException when PDFBox cannot parse the page content
     */
    public List<TextRun> collect(PDDocument document, int pageIndex) throws IOException {
        runs.clear();
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        getText(document);
        return List.copyOf(runs);
    }

    /**
     * Collects a whole {@code TJ} array as one run; the kerning numbers between its strings only move the
     * glyphs of that run.
     */
    @Override
    public void showTextStrings(COSArray array) throws IOException {
        beginRun();
        try {
            super.showTextStrings(array);
            flushRun();
        } finally {
            currentGlyphs = null;
        }
    }

    @Override
    protected void showText(byte[] string) throws IOException {
        if (currentGlyphs != null) {
            // string operand of an array already being collected
            super.showText(string);
            return;
        }
        beginRun();
        try {
            super.showText(string);
            flushRun();
        } finally {
            currentGlyphs = null;
        }
    }

    private void beginRun() {
        currentGlyphs = new ArrayList<>();
        currentColor = resolveFillColor();
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        if (currentGlyphs != null) {
            currentGlyphs.add(text);
        }
    }

    private void flushRun() {
        if (currentGlyphs.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        float width = 0f;
        float height = 0f;
        for (TextPosition glyph : currentGlyphs) {
            if (glyph.getUnicode() != null) {
                builder.append(glyph.getUnicode());
            }
            width += glyph.getWidthDirAdj();
            height = Math.max(height, glyph.getHeightDir());
        }
        if (builder.length() == 0) {
            return;
        }
        TextPosition first = currentGlyphs.get(0);
        String fontName = first.getFont() != null ? first.getFont().getName() : null;
        runs.add(new TextRun(
                builder.toString(),
                PdfBoxMatrices.toAffine(first.getTextMatrix()),
                width,
                height,
                fontName,
                currentColor
        ));
    }

    private RgbColor resolveFillColor() {
        PDColor color = getGraphicsState().getNonStrokingColor();
        if (color == null || color.getColorSpace() == null) {
            return RgbColor.BLACK;
        }
        try {
            return RgbColor.of(color.getColorSpace().toRGB(color.getComponents()));
        } catch (IOException | RuntimeException ex) {
            log.debug("Falling back to black for unsupported fill colour {}: {}", color, ex.getMessage());
            return RgbColor.BLACK;
        }
    }
}
