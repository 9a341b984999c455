package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.model.ImageFormat;
import com.example.pdflayout.infrastructure.config.PdfLayoutProperties;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.color.PDColorSpace;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceGray;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceRGB;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.List;

/**
 * Converts between PDF image XObjects and portable encoded image bytes.
 * The format of incoming bytes is always sniffed from their content.
 */
@Component
public class PdfBoxImageCodec {

    private static final String DATA_URI_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    private final PdfLayoutProperties properties;

    public PdfBoxImageCodec(PdfLayoutProperties properties) {
        this.properties = properties;
    }

    /**
     * Re-encodes an image XObject. DCT images in RGB or gray are passed through untouched when
     * {@code pdf-layout.preserve-jpeg} is on; everything else is decoded and written as PNG.
     *
     * @param image image resolved from the page resources
     * @return encoded image bytes
     * @throws IOException when PDFBox cannot decode the image
     */
    public byte[] encode(PDImageXObject image) throws IOException {
        if (properties.isPreserveJpeg() && isPassThroughJpeg(image)) {
            try (InputStream raw = image.createInputStream(List.of(COSName.DCT_DECODE.getName()))) {
                byte[] jpeg = raw.readAllBytes();
                if (ImageFormat.detect(jpeg) == ImageFormat.JPEG) {
                    return jpeg;
                }
            }
        }
        BufferedImage decoded = image.getImage();
        if (decoded == null) {
            throw new IOException("Image could not be decoded");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(decoded, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    /**
     * @param bytes encoded image
     * @return data URI labelled with the sniffed media type
     */
    public String toDataUri(byte[] bytes) {
        return DATA_URI_PREFIX + ImageFormat.detect(bytes).mediaType() + BASE64_MARKER
                + Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Decodes an element source given either as a data URI or as bare base64. Any media type in the
     * URI is ignored.
     *
     * @param src element source
     * @return decoded bytes
     * @throws IllegalArgumentException when the payload is not valid base64
     */
    public byte[] decodeSource(String src) {
        if (src == null || src.isBlank()) {
            throw new IllegalArgumentException("Image source is empty");
        }
        String payload = src.strip();
        if (payload.startsWith(DATA_URI_PREFIX)) {
            int marker = payload.indexOf(BASE64_MARKER);
            if (marker < 0) {
                throw new IllegalArgumentException("Only base64 data URIs are supported");
            }
            payload = payload.substring(marker + BASE64_MARKER.length());
        }
        return Base64.getMimeDecoder().decode(payload);
    }

    /**
     * Creates an image XObject for the target document, choosing the factory from the sniffed format.
     *
     * @param document target document
     * @param bytes    encoded image
     * @param name     label used by PDFBox for diagnostics
     * @return embeddable image
     * @throws IOException when the bytes cannot be decoded
     */
    public PDImageXObject embed(PDDocument document, byte[] bytes, String name) throws IOException {
        ImageFormat format = ImageFormat.detect(bytes);
        return switch (format) {
            case JPEG -> JPEGFactory.createFromByteArray(document, bytes);
            case PNG, GIF, BMP, TIFF -> embedLossless(document, bytes, format);
            default -> PDImageXObject.createFromByteArray(document, bytes, name);
        };
    }

    private PDImageXObject embedLossless(PDDocument document, byte[] bytes, ImageFormat format) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("Unreadable " + format + " image");
        }
        return LosslessFactory.createFromImage(document, image);
    }

    private boolean isPassThroughJpeg(PDImageXObject image) throws IOException {
        if (!"jpg".equals(image.getSuffix())) {
            return false;
        }
        PDColorSpace colorSpace = image.getColorSpace();
        return colorSpace instanceof PDDeviceRGB || colorSpace instanceof PDDeviceGray;
    }
}
