package com.example.pdflayout.domain.exception;

/**
 * Raised when a filesystem extraction is started with a {@code null} path.
 */
public class PdfPathRequiredException extends DomainException {

    /**
     * Creates the exception with a predefined error message.
     */
    public PdfPathRequiredException() {
        super("PDF path is required.");
    }
}
