package com.example.pdflayout.application.service;

import com.example.pdflayout.domain.exception.PdfFileRequiredException;
import com.example.pdflayout.domain.exception.PdfNotFoundException;
import com.example.pdflayout.domain.exception.PdfPathRequiredException;
import com.example.pdflayout.domain.exception.UnsupportedPdfFormatException;
import com.example.pdflayout.domain.geometry.Footprint;
import com.example.pdflayout.domain.geometry.LayoutGeometry;
import com.example.pdflayout.domain.geometry.Placement;
import com.example.pdflayout.domain.model.DocumentLayout;
import com.example.pdflayout.domain.model.ImageElement;
import com.example.pdflayout.domain.model.LayoutElement;
import com.example.pdflayout.domain.model.LayoutFeature;
import com.example.pdflayout.domain.model.PageDescriptor;
import com.example.pdflayout.domain.model.PdfDocumentMetadata;
import com.example.pdflayout.domain.model.TextElement;
import com.example.pdflayout.domain.trace.ImagePaint;
import com.example.pdflayout.domain.trace.ImagePlacementResolver;
import com.example.pdflayout.infrastructure.config.PdfLayoutProperties;
import com.example.pdflayout.infrastructure.exception.PdfProcessingException;
import com.example.pdflayout.infrastructure.pdf.OperatorTraceRecorder;
import com.example.pdflayout.infrastructure.pdf.PdfBoxImageCodec;
import com.example.pdflayout.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.pdflayout.infrastructure.pdf.RecordedTrace;
import com.example.pdflayout.infrastructure.pdf.TextRun;
import com.example.pdflayout.infrastructure.pdf.TextRunCollector;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Application-layer service behind the Extract operation.
 * Produces one {@link PageDescriptor} per source page with text runs first, in run order, followed by the
 * images found in the page's operator trace. All positions are converted to the canonical top-left frame.
 */
@Service
public class PdfLayoutExtractionService {

    private static final Logger log = LoggerFactory.getLogger(PdfLayoutExtractionService.class);
    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final PdfBoxImageCodec imageCodec;
    private final PdfBoxMetadataReader metadataReader;
    private final PdfLayoutProperties properties;

    /**
     * @param imageCodec     re-encodes image XObjects into portable bytes
     * @param metadataReader maps the info dictionary and XMP packet
     * @param properties     extraction tunables
     */
    public PdfLayoutExtractionService(PdfBoxImageCodec imageCodec,
                                      PdfBoxMetadataReader metadataReader,
                                      PdfLayoutProperties properties) {
        this.imageCodec = imageCodec;
        this.metadataReader = metadataReader;
        this.properties = properties;
    }

    public DocumentLayout extract(MultipartFile file) {
        return extract(file, LayoutFeature.allFeatures());
    }

    /**
     * Extracts the requested parts of an uploaded PDF.
     *
     * @param file     uploaded file
     * @param features parts to extract, empty means all
     * @return page layouts in source page order
     * @throws PdfFileRequiredException      when the upload is missing or empty
     * @throws UnsupportedPdfFormatException when the upload does not look like a PDF
     * @throws PdfProcessingException        when the document or one of its pages cannot be parsed
     */
    public DocumentLayout extract(MultipartFile file, Set<LayoutFeature> features) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF file.", e);
        }
        if (!looksLikePdf(file, bytes)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        return extract(bytes, features);
    }

    public DocumentLayout extract(Path pdfPath) {
        return extract(pdfPath, LayoutFeature.allFeatures());
    }

    /**
     * Extracts the requested parts of a PDF on disk.
     *
     * @param pdfPath  path to the PDF
     * @param features parts to extract, empty means all
     * @return page layouts in source page order
     * @throws PdfPathRequiredException when {@code pdfPath} is null
     * @throws PdfNotFoundException     when the path does not exist
     * @throws PdfProcessingException   when the file cannot be read or parsed
     */
    public DocumentLayout extract(Path pdfPath, Set<LayoutFeature> features) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        try {
            return extract(Files.readAllBytes(pdfPath), features);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the PDF at " + pdfPath, e);
        }
    }

    /**
     * Extracts the requested parts of an in-memory PDF. Either every page succeeds or the whole call fails;
     * only individual images are allowed to drop out.
     *
     * @param bytes    PDF bytes
     * @param features parts to extract, empty means all
     * @return page layouts in source page order
     */
    public DocumentLayout extract(byte[] bytes, Set<LayoutFeature> features) {
        if (bytes == null || bytes.length == 0) {
            throw new PdfFileRequiredException();
        }
        EnumSet<LayoutFeature> normalized = normalizeFeatures(features);
        try (PDDocument document = Loader.loadPDF(bytes)) {
            TextRunCollector textCollector = normalized.contains(LayoutFeature.TEXT) ? new TextRunCollector() : null;
            List<PageDescriptor> pages = new ArrayList<>(document.getNumberOfPages());
            for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
                ensureNotCancelled(pageIndex);
                pages.add(extractPage(document, pageIndex, textCollector, normalized.contains(LayoutFeature.IMAGES)));
            }
            PdfDocumentMetadata metadata = normalized.contains(LayoutFeature.DOCUMENT_METADATA)
                    ? metadataReader.readMetadata(document, bytes.length)
                    : null;
            log.debug("Extracted {} page(s) from {} bytes", pages.size(), bytes.length);
            return new DocumentLayout(pages, metadata);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the PDF document: " + e.getMessage(), e);
        }
    }

    private EnumSet<LayoutFeature> normalizeFeatures(Set<LayoutFeature> features) {
        if (features == null || features.isEmpty()) {
            return LayoutFeature.allFeatures();
        }
        return EnumSet.copyOf(features);
    }

    /**
     * Builds the descriptor of one page. Text and trace parsing errors fail the page; image resolution
     * errors only drop the affected image.
     *
     * @param document      loaded document
     * @param pageIndex     zero-based page index
     * @param textCollector collector for text runs, {@code null} when text is not requested
     * @param withImages    whether to scan the operator trace for images
     * @return page descriptor
     */
    private PageDescriptor extractPage(PDDocument document,
                                       int pageIndex,
                                       TextRunCollector textCollector,
                                       boolean withImages) {
        PDPage page = document.getPage(pageIndex);
        PDRectangle cropBox = page.getCropBox();
        double pageHeight = cropBox.getHeight();
        List<LayoutElement> elements = new ArrayList<>();
        try {
            if (textCollector != null) {
                for (TextRun run : textCollector.collect(document, pageIndex)) {
                    elements.add(toTextElement(run, pageHeight));
                }
            }
            if (withImages) {
                elements.addAll(extractImages(page, cropBox, pageIndex));
            }
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to extract page " + (pageIndex + 1) + ": " + e.getMessage(), e);
        }
        return new PageDescriptor(cropBox.getWidth(), pageHeight, page.getRotation(), elements);
    }

    private TextElement toTextElement(TextRun run, double pageHeight) {
        Placement placement = LayoutGeometry.matrixToOrigin(run.transform(), pageHeight);
        double fontSize = placement.fallback() ? properties.getDefaultFontSize() : placement.scaleY();
        return new TextElement(
                run.text(),
                placement.x(),
                placement.y(),
                fontSize,
                run.width(),
                run.height(),
                run.fontName(),
                run.color()
        );
    }

    /**
     * Scans the page's operator trace once and turns every image paint into an element.
     *
     * @param page      page to scan
     * @param cropBox   visible page area; transforms are made relative to its lower-left corner
     * @param pageIndex zero-based page index, for logging
     * @return image elements in paint order
     * @throws IOException when the content stream cannot be replayed
     */
    private List<ImageElement> extractImages(PDPage page, PDRectangle cropBox, int pageIndex) throws IOException {
        RecordedTrace trace = new OperatorTraceRecorder().record(page);
        List<ImageElement> images = new ArrayList<>();
        for (ImagePaint paint : ImagePlacementResolver.resolve(trace.operators())) {
            try {
                PDImageXObject image = trace.resolveImage(paint);
                String src = imageCodec.toDataUri(imageCodec.encode(image));
                images.add(toImageElement(paint, image, src, cropBox));
            } catch (IOException | RuntimeException ex) {
                log.warn("Skipping image {} on page {}: {}", paint.resourceName(), pageIndex + 1, ex.getMessage());
            }
        }
        return images;
    }

    private ImageElement toImageElement(ImagePaint paint, PDImageXObject image, String src, PDRectangle cropBox) {
        double[] transform = paint.transform();
        transform[4] -= cropBox.getLowerLeftX();
        transform[5] -= cropBox.getLowerLeftY();
        Footprint footprint = LayoutGeometry.unitSquareFootprint(transform, cropBox.getHeight());
        if (footprint.fallback()) {
            return new ImageElement(src, 0, 0, image.getWidth(), image.getHeight());
        }
        return new ImageElement(src, footprint.x(), footprint.y(), footprint.width(), footprint.height());
    }

    private void ensureNotCancelled(int pageIndex) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PdfProcessingException("Extraction cancelled before page " + (pageIndex + 1),
                    new InterruptedException());
        }
    }

    /**
     * Accepts uploads labelled as PDF by MIME type or file name, or carrying the {@code %PDF} signature.
     *
     * @param file  uploaded file
     * @param bytes file content
     * @return {@code true} when the upload looks like a PDF
     */
    private boolean looksLikePdf(MultipartFile file, byte[] bytes) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return true;
        }
        if (bytes.length < PDF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PDF_SIGNATURE.length; i++) {
            if (bytes[i] != PDF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }
}
