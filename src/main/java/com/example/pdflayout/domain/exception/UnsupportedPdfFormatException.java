package com.example.pdflayout.domain.exception;

/**
 * Raised when an upload is neither labelled as a PDF nor starts with the {@code %PDF} signature.
 */
public class UnsupportedPdfFormatException extends DomainException {

    /**
     * Creates the exception and mentions the offending file so the caller can react.
     *
     * @param fileName original file name supplied by the client, may be {@code null}
     */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
