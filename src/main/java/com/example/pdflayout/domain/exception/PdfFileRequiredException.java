package com.example.pdflayout.domain.exception;

/**
 * Raised when an extraction is requested without any PDF bytes.
 */
public class PdfFileRequiredException extends DomainException {

    /**
     * Creates the exception with a user-friendly explanation.
     */
    public PdfFileRequiredException() {
        super("Please choose a PDF file to convert.");
    }
}
