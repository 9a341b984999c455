package com.example.pdflayout.support;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceRGB;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Builds small in-memory PDFs and images for tests.
 */
public final class TestDocuments {

    private TestDocuments() {
    }

    /**
     * @return letter-sized single page PDF with one Helvetica run
     */
    public static byte[] textPdf(String text, float x, float y, float fontSize) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), fontSize);
                contentStream.newLineAtOffset(x, y);
                contentStream.showText(text);
                contentStream.endText();
            }
            return save(document);
        }
    }

    /**
     * @return letter-sized single page PDF with a text run followed by one image placed at the given box
     */
    public static byte[] textAndImagePdf(String text, float imageX, float imageY, float imageWidth, float imageHeight)
            throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            PDImageXObject image = LosslessFactory.createFromImage(document, solidImage(10, 5, Color.RED));
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.drawImage(image, imageX, imageY, imageWidth, imageHeight);
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                contentStream.newLineAtOffset(72, 72);
                contentStream.showText(text);
                contentStream.endText();
            }
            return save(document);
        }
    }

    /**
     * @return letter-sized single page PDF with one 10x5 pixel image drawn through {@code placement}
     */
    public static byte[] imagePdf(Matrix placement) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            PDImageXObject image = LosslessFactory.createFromImage(document, solidImage(10, 5, Color.RED));
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.drawImage(image, placement);
            }
            return save(document);
        }
    }

    /**
     * @return letter-sized page painting an image whose stream uses an unknown filter, then a valid image
     *         at the given box
     */
    public static byte[] undecodableThenValidImagePdf(float x, float y, float width, float height)
            throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            PDImageXObject broken = new PDImageXObject(document, new ByteArrayInputStream(new byte[]{1, 2, 3, 4}),
                    COSName.getPDFName("NoSuchDecode"), 2, 2, 8, PDDeviceRGB.INSTANCE);
            PDImageXObject valid = LosslessFactory.createFromImage(document, solidImage(10, 5, Color.RED));
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.drawImage(broken, 10, 10, 20, 20);
                contentStream.drawImage(valid, x, y, width, height);
            }
            return save(document);
        }
    }

    /**
     * @return letter-sized single page PDF showing {@code segments} with one {@code TJ} operator at (72, 700)
     */
    public static byte[] kernedTextPdf(Object... segments) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                contentStream.newLineAtOffset(72, 700);
                contentStream.showTextWithPositioning(segments);
                contentStream.endText();
            }
            return save(document);
        }
    }

    public static byte[] emptyPdf() throws IOException {
        try (PDDocument document = new PDDocument()) {
            return save(document);
        }
    }

    public static BufferedImage solidImage(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, color.getRGB());
            }
        }
        return image;
    }

    public static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, format, out);
        return out.toByteArray();
    }

    public static String pngDataUri(int width, int height) throws IOException {
        byte[] png = encode(solidImage(width, height, Color.BLUE), "png");
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(png);
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        document.save(outputStream);
        return outputStream.toByteArray();
    }
}
