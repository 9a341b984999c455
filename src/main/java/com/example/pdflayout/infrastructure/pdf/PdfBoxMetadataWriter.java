package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.model.PdfDocumentMetadata;
import com.example.pdflayout.domain.model.PdfInfoDictionary;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.springframework.stereotype.Component;

/**
 * Copies the text fields of extracted metadata onto a reconstructed document's info dictionary.
 */
@Component
public class PdfBoxMetadataWriter {

    /**
     * @param document target document
     * @param metadata metadata from the layout, may be {@code null}
     */
    public void writeMetadata(PDDocument document, PdfDocumentMetadata metadata) {
        if (metadata == null || metadata.info() == null) {
            return;
        }
        PdfInfoDictionary source = metadata.info();
        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(source.title());
        info.setAuthor(source.author());
        info.setSubject(source.subject());
        info.setKeywords(source.keywords());
        info.setCreator(source.creator());
        info.setProducer(source.producer());
    }
}
