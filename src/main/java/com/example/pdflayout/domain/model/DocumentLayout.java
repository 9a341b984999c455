package com.example.pdflayout.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Intermediate representation exchanged between the extractor and the reconstructor.
 * {@code pages} is left {@code null} when a client omits it so the reconstructor can reject the request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentLayout(
        List<PageDescriptor> pages,
        PdfDocumentMetadata metadata
) {

    public static DocumentLayout of(List<PageDescriptor> pages) {
        return new DocumentLayout(pages, null);
    }
}
