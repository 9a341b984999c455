package com.example.pdflayout.application.service;

import com.example.pdflayout.domain.exception.PdfFileRequiredException;
import com.example.pdflayout.domain.exception.PdfNotFoundException;
import com.example.pdflayout.domain.exception.PdfPathRequiredException;
import com.example.pdflayout.domain.exception.UnsupportedPdfFormatException;
import com.example.pdflayout.domain.model.DocumentLayout;
import com.example.pdflayout.domain.model.ImageElement;
import com.example.pdflayout.domain.model.LayoutFeature;
import com.example.pdflayout.domain.model.PageDescriptor;
import com.example.pdflayout.domain.model.TextElement;
import com.example.pdflayout.infrastructure.config.PdfLayoutProperties;
import com.example.pdflayout.infrastructure.exception.PdfProcessingException;
import com.example.pdflayout.infrastructure.pdf.PdfBoxImageCodec;
import com.example.pdflayout.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.pdflayout.support.TestDocuments;

import org.apache.pdfbox.util.Matrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the Extract operation against PDFs built in memory.
 */
class PdfLayoutExtractionServiceTest {

    private final PdfLayoutProperties properties = new PdfLayoutProperties();
    private final PdfLayoutExtractionService service = new PdfLayoutExtractionService(
            new PdfBoxImageCodec(properties), new PdfBoxMetadataReader(), properties);

    @Test
    void extractsTextRunInCanonicalCoordinates() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "sample.pdf", "application/pdf", TestDocuments.textPdf("Hello Layout", 72, 700, 18));

        DocumentLayout layout = service.extract(file);

        assertThat(layout.pages()).hasSize(1);
        PageDescriptor page = layout.pages().get(0);
        assertThat(page.width()).isCloseTo(612, within(0.01));
        assertThat(page.height()).isCloseTo(792, within(0.01));
        assertThat(page.rotation()).isZero();
        assertThat(page.elements()).singleElement().isInstanceOf(TextElement.class);

        TextElement text = (TextElement) page.elements().get(0);
        assertThat(text.text()).isEqualTo("Hello Layout");
        assertThat(text.x()).isCloseTo(72, within(0.01));
        assertThat(text.y()).isCloseTo(92, within(0.01));
        assertThat(text.fontSize()).isCloseTo(18, within(0.01));
        assertThat(text.width()).isPositive();
        assertThat(text.fontName()).contains("Helvetica");
        assertThat(text.color().r()).isZero();
    }

    @Test
    void imagesFollowTextWithPlacedFootprint() throws Exception {
        byte[] pdf = TestDocuments.textAndImagePdf("Caption", 100, 200, 50, 25);

        DocumentLayout layout = service.extract(pdf, LayoutFeature.allFeatures());

        PageDescriptor page = layout.pages().get(0);
        assertThat(page.elements()).hasSize(2);
        assertThat(page.elements().get(0)).isInstanceOf(TextElement.class);
        assertThat(page.elements().get(1)).isInstanceOf(ImageElement.class);

        ImageElement image = (ImageElement) page.elements().get(1);
        assertThat(image.x()).isCloseTo(100, within(0.01));
        assertThat(image.y()).isCloseTo(792 - 200 - 25, within(0.01));
        assertThat(image.width()).isCloseTo(50, within(0.01));
        assertThat(image.height()).isCloseTo(25, within(0.01));
        assertThat(image.src()).startsWith("data:image/png;base64,");
    }

    @Test
    void mirroredImageKeepsItsTopLeftCorner() throws Exception {
        byte[] pdf = TestDocuments.imagePdf(new Matrix(50, 0, 0, -25, 100, 225));

        ImageElement image = singleImage(service.extract(pdf, EnumSet.of(LayoutFeature.IMAGES)));

        assertThat(image.x()).isCloseTo(100, within(0.01));
        assertThat(image.y()).isCloseTo(567, within(0.01));
        assertThat(image.width()).isCloseTo(50, within(0.01));
        assertThat(image.height()).isCloseTo(25, within(0.01));
    }

    @Test
    void quarterTurnImageReportsItsPlacedBoundingBox() throws Exception {
        byte[] pdf = TestDocuments.imagePdf(new Matrix(0, 50, -25, 0, 125, 200));

        ImageElement image = singleImage(service.extract(pdf, EnumSet.of(LayoutFeature.IMAGES)));

        assertThat(image.x()).isCloseTo(100, within(0.01));
        assertThat(image.y()).isCloseTo(542, within(0.01));
        assertThat(image.width()).isCloseTo(25, within(0.01));
        assertThat(image.height()).isCloseTo(50, within(0.01));
    }

    @Test
    void degenerateImageTransformFallsBackToNaturalSizeAtOrigin() throws Exception {
        byte[] pdf = TestDocuments.imagePdf(new Matrix(0, 0, 0, 0, 30, 40));

        ImageElement image = singleImage(service.extract(pdf, EnumSet.of(LayoutFeature.IMAGES)));

        assertThat(image.x()).isZero();
        assertThat(image.y()).isZero();
        assertThat(image.width()).isEqualTo(10);
        assertThat(image.height()).isEqualTo(5);
    }

    @Test
    void undecodableImageIsSkippedAndPageStillExtracted() throws Exception {
        byte[] pdf = TestDocuments.undecodableThenValidImagePdf(100, 200, 50, 25);

        ImageElement image = singleImage(service.extract(pdf, EnumSet.of(LayoutFeature.IMAGES)));

        assertThat(image.x()).isCloseTo(100, within(0.01));
        assertThat(image.y()).isCloseTo(567, within(0.01));
        assertThat(image.src()).startsWith("data:image/png;base64,");
    }

    @Test
    void kernedTextArrayBecomesOneElement() throws Exception {
        byte[] pdf = TestDocuments.kernedTextPdf("W", 80f, "orld", -20f, " wide");

        DocumentLayout layout = service.extract(pdf, EnumSet.of(LayoutFeature.TEXT));

        assertThat(layout.pages().get(0).elements()).singleElement().isInstanceOf(TextElement.class);
        TextElement text = (TextElement) layout.pages().get(0).elements().get(0);
        assertThat(text.text()).isEqualTo("World wide");
        assertThat(text.x()).isCloseTo(72, within(0.01));
        assertThat(text.y()).isCloseTo(92, within(0.01));
    }

    @Test
    void zeroPageDocumentYieldsNoPages() throws Exception {
        DocumentLayout layout = service.extract(TestDocuments.emptyPdf(), EnumSet.of(LayoutFeature.TEXT));

        assertThat(layout.pages()).isEmpty();
        assertThat(layout.metadata()).isNull();
    }

    @Test
    void featureSelectionSkipsUnrequestedParts() throws Exception {
        byte[] pdf = TestDocuments.textAndImagePdf("Caption", 10, 10, 20, 20);

        DocumentLayout imagesOnly = service.extract(pdf, EnumSet.of(LayoutFeature.IMAGES));
        DocumentLayout withMetadata = service.extract(pdf, EnumSet.of(LayoutFeature.DOCUMENT_METADATA));

        assertThat(imagesOnly.pages().get(0).elements()).singleElement().isInstanceOf(ImageElement.class);
        assertThat(imagesOnly.metadata()).isNull();
        assertThat(withMetadata.pages().get(0).elements()).isEmpty();
        assertThat(withMetadata.metadata()).isNotNull();
        assertThat(withMetadata.metadata().pageCount()).isEqualTo(1);
        assertThat(withMetadata.metadata().sourceSizeBytes()).isEqualTo(pdf.length);
    }

    @Test
    void unreadableDocumentFailsWholeExtraction() {
        byte[] garbage = "this is not a pdf".getBytes(StandardCharsets.US_ASCII);

        assertThrows(PdfProcessingException.class, () -> service.extract(garbage, LayoutFeature.allFeatures()));
    }

    @Test
    void rejectsNonPdfUploads() {
        MockMultipartFile file = new MockMultipartFile(
                "file", "note.txt", "text/plain", "plain text".getBytes(StandardCharsets.UTF_8));

        assertThrows(UnsupportedPdfFormatException.class, () -> service.extract(file));
    }

    @Test
    void acceptsUnlabelledUploadWithPdfSignature() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "blob", "application/octet-stream", TestDocuments.textPdf("Signed", 10, 10, 10));

        assertThat(service.extract(file).pages()).hasSize(1);
    }

    @Test
    void requiresFile() {
        MockMultipartFile file = new MockMultipartFile("file", new byte[0]);

        assertThrows(PdfFileRequiredException.class, () -> service.extract(file));
        assertThrows(PdfFileRequiredException.class, () -> service.extract((byte[]) null, null));
    }

    @Test
    void extractsFromPath(@TempDir Path tempDir) throws Exception {
        Path pdfPath = tempDir.resolve("disk.pdf");
        Files.write(pdfPath, TestDocuments.textPdf("On disk", 50, 50, 10));

        DocumentLayout layout = service.extract(pdfPath);

        assertThat(layout.pages().get(0).elements())
                .singleElement()
                .satisfies(element -> assertThat(((TextElement) element).text()).isEqualTo("On disk"));
    }

    @Test
    void pathGuards(@TempDir Path tempDir) {
        assertThrows(PdfPathRequiredException.class, () -> service.extract((Path) null));
        assertThrows(PdfNotFoundException.class, () -> service.extract(tempDir.resolve("missing.pdf")));
    }

    private static ImageElement singleImage(DocumentLayout layout) {
        assertThat(layout.pages()).hasSize(1);
        assertThat(layout.pages().get(0).elements()).singleElement().isInstanceOf(ImageElement.class);
        return (ImageElement) layout.pages().get(0).elements().get(0);
    }
}
