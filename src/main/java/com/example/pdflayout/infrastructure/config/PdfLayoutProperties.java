package com.example.pdflayout.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for extraction and reconstruction, bound from {@code pdf-layout.*}.
 */
@Component
@ConfigurationProperties(prefix = "pdf-layout")
public class PdfLayoutProperties {

    /**
     * Font size used when a text element carries no usable size.
     */
    private double defaultFontSize = 12;

    /**
     * Reject text elements with missing text or an unusable font size instead of filling defaults.
     */
    private boolean strictTextValidation = false;

    /**
     * Pass DCT encoded RGB/gray images through as JPEG instead of re-encoding them to PNG.
     */
    private boolean preserveJpeg = true;

    /**
     * Copy the info dictionary of an incoming metadata block onto reconstructed documents.
     */
    private boolean writeDocumentMetadata = true;

    public double getDefaultFontSize() {
        return defaultFontSize;
    }

    public void setDefaultFontSize(double defaultFontSize) {
        this.defaultFontSize = defaultFontSize;
    }

    public boolean isStrictTextValidation() {
        return strictTextValidation;
    }

    public void setStrictTextValidation(boolean strictTextValidation) {
        this.strictTextValidation = strictTextValidation;
    }

    public boolean isPreserveJpeg() {
        return preserveJpeg;
    }

    public void setPreserveJpeg(boolean preserveJpeg) {
        this.preserveJpeg = preserveJpeg;
    }

    public boolean isWriteDocumentMetadata() {
        return writeDocumentMetadata;
    }

    public void setWriteDocumentMetadata(boolean writeDocumentMetadata) {
        this.writeDocumentMetadata = writeDocumentMetadata;
    }
}
