package com.example.pdflayout.application.service;

import com.example.pdflayout.application.exception.LayoutValidationException;
import com.example.pdflayout.application.exception.UseCaseValidationException;
import com.example.pdflayout.domain.exception.LayoutPagesRequiredException;
import com.example.pdflayout.domain.geometry.LayoutGeometry;
import com.example.pdflayout.domain.model.DocumentLayout;
import com.example.pdflayout.domain.model.ImageElement;
import com.example.pdflayout.domain.model.LayoutElement;
import com.example.pdflayout.domain.model.PageDescriptor;
import com.example.pdflayout.domain.model.ReconstructedDocument;
import com.example.pdflayout.domain.model.RgbColor;
import com.example.pdflayout.domain.model.TextElement;
import com.example.pdflayout.infrastructure.config.PdfLayoutProperties;
import com.example.pdflayout.infrastructure.exception.PdfWriteException;
import com.example.pdflayout.infrastructure.pdf.PdfBoxImageCodec;
import com.example.pdflayout.infrastructure.pdf.PdfBoxMetadataWriter;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Application-layer service behind the Reconstruct operation.
 * Builds a new PDF page by page from a {@link DocumentLayout}. Images are painted before text on every page,
 * each class keeping its relative order. Text is drawn with a single standard font; only position, size and
 * fill colour survive. An element that cannot be drawn is logged and skipped without failing the document.
 */
@Service
public class PdfLayoutReconstructionService {

    private static final Logger log = LoggerFactory.getLogger(PdfLayoutReconstructionService.class);
    private static final int FILE_HASH_PREFIX = 16;
    private static final String REPLACEMENT_CHARACTER = "?";

    private final PdfBoxImageCodec imageCodec;
    private final PdfBoxMetadataWriter metadataWriter;
    private final PdfLayoutProperties properties;
    private final PDFont defaultFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    /**
     * @param imageCodec     decodes and embeds element images
     * @param metadataWriter copies document metadata onto the output
     * @param properties     reconstruction tunables
     */
    public PdfLayoutReconstructionService(PdfBoxImageCodec imageCodec,
                                          PdfBoxMetadataWriter metadataWriter,
                                          PdfLayoutProperties properties) {
        this.imageCodec = imageCodec;
        this.metadataWriter = metadataWriter;
        this.properties = properties;
    }

    /**
     * Reconstructs a PDF from a page layout list.
     *
     * @param layout layout as produced by the extractor
     * @return serialized document and its content-addressable name
     * @throws LayoutPagesRequiredException when {@code pages} is missing
     * @throws UseCaseValidationException   when a page entry is unusable
     * @throws PdfWriteException            when the output document cannot be produced
     */
    public ReconstructedDocument reconstruct(DocumentLayout layout) {
        if (layout == null || layout.pages() == null) {
            throw new LayoutPagesRequiredException();
        }
        List<PageDescriptor> pages = layout.pages();
        validatePages(pages);

        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
                ensureNotCancelled(pageIndex);
                renderPage(document, pages.get(pageIndex), pageIndex);
            }
            if (properties.isWriteDocumentMetadata()) {
                metadataWriter.writeMetadata(document, layout.metadata());
            }
            document.save(outputStream);
            byte[] content = outputStream.toByteArray();
            log.info("Reconstructed {} page(s) into {} bytes", pages.size(), content.length);
            return new ReconstructedDocument(contentAddressableName(content), content);
        } catch (IOException e) {
            throw new PdfWriteException("Unable to write the reconstructed PDF: " + e.getMessage(), e);
        }
    }

    /**
     * Orders elements for painting: every image first, then every text run, each group keeping its input order.
     *
     * @param elements elements in extraction order
     * @return elements in paint order, {@code null} entries dropped
     */
    static List<LayoutElement> paintOrder(List<LayoutElement> elements) {
        List<LayoutElement> ordered = new ArrayList<>(elements.size());
        for (LayoutElement element : elements) {
            if (element instanceof ImageElement) {
                ordered.add(element);
            }
        }
        for (LayoutElement element : elements) {
            if (element instanceof TextElement) {
                ordered.add(element);
            }
        }
        return ordered;
    }

    private void validatePages(List<PageDescriptor> pages) {
        for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
            PageDescriptor page = pages.get(pageIndex);
            if (page == null) {
                throw new UseCaseValidationException("Page " + pageIndex + " is empty.");
            }
            if (!isPositive(page.width()) || !isPositive(page.height())) {
                throw new UseCaseValidationException("Page " + pageIndex + " must have a positive width and height.");
            }
            if (properties.isStrictTextValidation()) {
                validateText(page.elements(), pageIndex);
            }
        }
    }

    private void validateText(List<LayoutElement> elements, int pageIndex) {
        for (int elementIndex = 0; elementIndex < elements.size(); elementIndex++) {
            if (elements.get(elementIndex) instanceof TextElement text) {
                if (text.text() == null) {
                    throw new LayoutValidationException(pageIndex, elementIndex, "text is required");
                }
                if (!isPositive(text.fontSize())) {
                    throw new LayoutValidationException(pageIndex, elementIndex, "fontSize must be a positive number");
                }
            }
        }
    }

    private void renderPage(PDDocument document, PageDescriptor descriptor, int pageIndex) throws IOException {
        PDPage page = new PDPage(new PDRectangle((float) descriptor.width(), (float) descriptor.height()));
        if (descriptor.rotation() != 0) {
            page.setRotation(descriptor.rotation());
        }
        document.addPage(page);

        List<LayoutElement> ordered = paintOrder(descriptor.elements());
        if (ordered.size() != descriptor.elements().size()) {
            log.warn("Ignoring {} empty element(s) on page {}", descriptor.elements().size() - ordered.size(), pageIndex);
        }
        try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
            for (int elementIndex = 0; elementIndex < ordered.size(); elementIndex++) {
                LayoutElement element = ordered.get(elementIndex);
                try {
                    if (element instanceof ImageElement image) {
                        drawImage(document, contentStream, image, descriptor.height(), pageIndex, elementIndex);
                    } else if (element instanceof TextElement text) {
                        drawText(contentStream, text, descriptor.height());
                    }
                } catch (IOException | RuntimeException ex) {
                    log.warn("Skipping {} element {} on page {}: {}",
                            element.getClass().getSimpleName(), elementIndex, pageIndex, ex.getMessage());
                }
            }
        }
    }

    private void drawImage(PDDocument document,
                           PDPageContentStream contentStream,
                           ImageElement element,
                           double pageHeight,
                           int pageIndex,
                           int elementIndex) throws IOException {
        requireFinite(element.x(), element.y());
        if (!isPositive(element.width()) || !isPositive(element.height())) {
            throw new IllegalArgumentException("image width and height must be positive");
        }
        byte[] bytes = imageCodec.decodeSource(element.src());
        PDImageXObject image = imageCodec.embed(document, bytes, "page" + pageIndex + "-image" + elementIndex);
        double rawY = LayoutGeometry.fromCanonicalY(element.y(), pageHeight, element.height());
        contentStream.drawImage(image, (float) element.x(), (float) rawY,
                (float) element.width(), (float) element.height());
    }

    private void drawText(PDPageContentStream contentStream, TextElement element, double pageHeight) throws IOException {
        if (element.text() == null || element.text().isEmpty()) {
            log.debug("Skipping text element without text at ({}, {})", element.x(), element.y());
            return;
        }
        requireFinite(element.x(), element.y());
        String text = encodableText(element.text());
        float fontSize = (float) (isPositive(element.fontSize()) ? element.fontSize() : properties.getDefaultFontSize());
        RgbColor color = element.color().clamped();
        double rawY = LayoutGeometry.fromCanonicalY(element.y(), pageHeight, 0);

        contentStream.beginText();
        try {
            contentStream.setFont(defaultFont, fontSize);
            contentStream.setNonStrokingColor((float) color.r(), (float) color.g(), (float) color.b());
            contentStream.newLineAtOffset((float) element.x(), (float) rawY);
            contentStream.showText(text);
        } finally {
            contentStream.endText();
        }
    }

    /**
     * Replaces characters the default font cannot encode so the rest of the run is still drawn.
     *
     * @param text raw element text
     * @return text that the default font can show
     */
    private String encodableText(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = Character.isWhitespace(codePoint) ? " " : new String(Character.toChars(codePoint));
            builder.append(canEncode(character) ? character : REPLACEMENT_CHARACTER);
        });
        return builder.toString();
    }

    private boolean canEncode(String character) {
        try {
            defaultFont.encode(character);
            return true;
        } catch (IOException | IllegalArgumentException ex) {
            return false;
        }
    }

    private String contentAddressableName(byte[] content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content);
            return "layout-" + HexFormat.of().formatHex(digest).substring(0, FILE_HASH_PREFIX) + ".pdf";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void ensureNotCancelled(int pageIndex) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PdfWriteException("Reconstruction cancelled before page " + pageIndex, new InterruptedException());
        }
    }

    private static void requireFinite(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("coordinates must be finite");
        }
    }

    private static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0;
    }
}
