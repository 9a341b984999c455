package com.example.pdflayout.infrastructure.exception;

/**
 * Signals that a source PDF could not be read or one of its pages could not be parsed.
 */
public class PdfProcessingException extends InfrastructureException {

    /**
     * Creates the exception with a contextual message and the root cause from PDFBox.
     *
     * @param message description shared with the application layer
     * @param cause   low-level PDFBox or IO exception
     */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
