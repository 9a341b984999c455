package com.example.pdflayout.domain.model;

/**
 * Serialized PDF produced by the reconstructor.
 *
 * @param fileName content-addressable name derived from the bytes
 * @param content  PDF bytes
 */
public record ReconstructedDocument(String fileName, byte[] content) {

    public long sizeBytes() {
        return content.length;
    }
}
