package com.example.pdflayout.domain.exception;

/**
 * Raised when a reconstruction request carries no {@code pages} list.
 */
public class LayoutPagesRequiredException extends DomainException {

    /**
     * Creates the exception with the message returned to API clients.
     */
    public LayoutPagesRequiredException() {
        super("Request body must contain a 'pages' array.");
    }
}
