package com.example.pdflayout.infrastructure.exception;

/**
 * Base unchecked exception for failures of the PDF engine or IO underneath the services.
 * These are document-level failures: no partial output accompanies them.
 */
public abstract class InfrastructureException extends RuntimeException {

    /**
     * Creates a new infrastructure exception while preserving the root cause.
     *
     * @param message context about the failure
     * @param cause   exception raised by the underlying library
     */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
