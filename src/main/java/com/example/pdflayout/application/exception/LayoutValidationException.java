package com.example.pdflayout.application.exception;

/**
 * Thrown by strict text validation when an element cannot be drawn as given.
 * Only raised when {@code pdf-layout.strict-text-validation} is enabled.
 */
public class LayoutValidationException extends UseCaseValidationException {

    private final int pageIndex;
    private final int elementIndex;
    private final String reason;

    /**
     * Creates the exception and records which element of which page was rejected.
     *
     * @param pageIndex    zero-based page index
     * @param elementIndex zero-based element index within the page
     * @param reason       what is wrong with the element
     */
    public LayoutValidationException(int pageIndex, int elementIndex, String reason) {
        super("Page " + pageIndex + ", element " + elementIndex + ": " + reason);
        this.pageIndex = pageIndex;
        this.elementIndex = elementIndex;
        this.reason = reason;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getElementIndex() {
        return elementIndex;
    }

    public String getReason() {
        return reason;
    }
}
