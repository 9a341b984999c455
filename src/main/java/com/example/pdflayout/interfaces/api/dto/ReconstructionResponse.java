package com.example.pdflayout.interfaces.api.dto;

import com.example.pdflayout.domain.model.ReconstructedDocument;

import java.util.Base64;

/**
 * JSON envelope for a reconstructed PDF. {@code sizeBytes} is the length of the decoded content.
 */
public record ReconstructionResponse(String fileName, long sizeBytes, String contentBase64) {

    public static ReconstructionResponse from(ReconstructedDocument document) {
        return new ReconstructionResponse(
                document.fileName(),
                document.sizeBytes(),
                Base64.getEncoder().encodeToString(document.content())
        );
    }
}
