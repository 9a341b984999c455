package com.example.pdflayout.domain.exception;

/**
 * Raised when a filesystem extraction points at a file that does not exist.
 */
public class PdfNotFoundException extends DomainException {

    /**
     * Creates the exception and records the missing path as part of the message.
     *
     * @param path path that could not be resolved
     */
    public PdfNotFoundException(String path) {
        super("PDF not found: " + path);
    }
}
