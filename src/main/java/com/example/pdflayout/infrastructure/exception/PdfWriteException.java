package com.example.pdflayout.infrastructure.exception;

/**
 * Signals that the output document could not be created or serialized.
 */
public class PdfWriteException extends InfrastructureException {

    /**
     * @param message description shared with the application layer
     * @param cause   exception raised while building or saving the document
     */
    public PdfWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
