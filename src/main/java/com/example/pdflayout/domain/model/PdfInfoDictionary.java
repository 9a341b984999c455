package com.example.pdflayout.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Text fields of the PDF info dictionary. Dates are display strings and are not written back.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PdfInfoDictionary(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer,
        String creationDate,
        String modificationDate
) {
}
