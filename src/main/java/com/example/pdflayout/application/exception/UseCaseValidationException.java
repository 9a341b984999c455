package com.example.pdflayout.application.exception;

/**
 * Signals that a use case received input it cannot act on.
 * Controllers translate this into a 400 response unless a subclass is mapped differently.
 */
public class UseCaseValidationException extends ApplicationException {

    /**
     * @param message specific validation failure
     */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
