package com.example.pdflayout.interfaces.api;

import com.example.pdflayout.application.service.PdfLayoutExtractionService;
import com.example.pdflayout.application.service.PdfLayoutReconstructionService;
import com.example.pdflayout.domain.model.DocumentLayout;
import com.example.pdflayout.domain.model.LayoutFeature;
import com.example.pdflayout.domain.model.ReconstructedDocument;
import com.example.pdflayout.interfaces.api.dto.ReconstructionResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Locale;

/**
 * REST endpoints for PDF to layout JSON and layout JSON to PDF conversion.
 * The unprefixed paths are kept for clients of the first version of the service.
 */
@RestController
public class PdfLayoutController {

    private final PdfLayoutExtractionService extractionService;
    private final PdfLayoutReconstructionService reconstructionService;

    public PdfLayoutController(PdfLayoutExtractionService extractionService,
                               PdfLayoutReconstructionService reconstructionService) {
        this.extractionService = extractionService;
        this.reconstructionService = reconstructionService;
    }

    /**
     * Converts an uploaded PDF into its page layouts.
     *
     * @param file          uploaded PDF
     * @param featureParams optional subset of {@link LayoutFeature} names
     * @return layout JSON served as a downloadable attachment
     */
    @PostMapping(value = {"/api/extract", "/pdfToJson"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DocumentLayout> extract(@RequestParam("file") MultipartFile file,
                                                  @RequestParam(value = "features", required = false) List<String> featureParams) {
        DocumentLayout layout = extractionService.extract(file, LayoutFeature.fromStrings(featureParams));
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(jsonFileName(file.getOriginalFilename()))
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(layout);
    }

    /**
     * Rebuilds a PDF from page layouts and streams it back.
     *
     * @param layout page layouts
     * @return PDF bytes with a content-addressable file name
     */
    @PostMapping(value = {"/api/reconstruct", "/jsonToPdf"},
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> reconstruct(@RequestBody DocumentLayout layout) {
        ReconstructedDocument document = reconstructionService.reconstruct(layout);
        ContentDisposition disposition = ContentDisposition.attachment().filename(document.fileName()).build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_PDF)
                .contentLength(document.sizeBytes())
                .body(document.content());
    }

    /**
     * Same as {@link #reconstruct(DocumentLayout)} but wraps the PDF in a JSON envelope.
     *
     * @param layout page layouts
     * @return base64 content with its file name and decoded size
     */
    @PostMapping(value = "/api/reconstruct/base64",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconstructionResponse> reconstructBase64(@RequestBody DocumentLayout layout) {
        return ResponseEntity.ok(ReconstructionResponse.from(reconstructionService.reconstruct(layout)));
    }

    private String jsonFileName(String originalFileName) {
        if (originalFileName == null || originalFileName.isBlank()) {
            return "document.json";
        }
        String baseName = originalFileName;
        int slash = Math.max(baseName.lastIndexOf('/'), baseName.lastIndexOf('\\'));
        if (slash >= 0) {
            baseName = baseName.substring(slash + 1);
        }
        if (baseName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            baseName = baseName.substring(0, baseName.length() - 4);
        }
        return baseName.isBlank() ? "document.json" : baseName + ".json";
    }
}
