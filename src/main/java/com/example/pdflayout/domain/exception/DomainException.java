package com.example.pdflayout.domain.exception;

/**
 * Base type for input the layout model refuses to work with.
 * Raised before any PDF engine call is made.
 */
public abstract class DomainException extends RuntimeException {

    /**
     * Creates a domain exception with a descriptive failure message.
     *
     * @param message explanation of which input rule was broken
     */
    protected DomainException(String message) {
        super(message);
    }
}
