package com.example.pdflayout.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Document-level facts captured on extraction. Only the info dictionary is written back on reconstruction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PdfDocumentMetadata(
        int pageCount,
        String pdfVersion,
        boolean encrypted,
        long sourceSizeBytes,
        PdfInfoDictionary info,
        PdfXmpMetadata xmp
) {
}
