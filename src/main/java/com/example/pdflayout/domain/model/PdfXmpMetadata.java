package com.example.pdflayout.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Dublin Core and XMP basic values read from the catalog metadata stream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PdfXmpMetadata(
        String title,
        String creators,
        String createDate,
        String creatorTool
) {
}
