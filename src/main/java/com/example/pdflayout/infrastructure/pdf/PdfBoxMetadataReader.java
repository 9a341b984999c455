package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.model.PdfDocumentMetadata;
import com.example.pdflayout.domain.model.PdfInfoDictionary;
import com.example.pdflayout.domain.model.PdfXmpMetadata;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.List;

/**
 * Reads the info dictionary and XMP packet of a source document into layout metadata.
 */
@Component
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * @param document        opened source document
     * @param sourceSizeBytes size of the bytes the document was loaded from
     * @return metadata, never {@code null}
     */
    public PdfDocumentMetadata readMetadata(PDDocument document, long sourceSizeBytes) {
        return new PdfDocumentMetadata(
                document.getNumberOfPages(),
                String.valueOf(document.getVersion()),
                document.isEncrypted(),
                sourceSizeBytes,
                extractInfo(document.getDocumentInformation()),
                extractXmp(document.getDocumentCatalog())
        );
    }

    private PdfInfoDictionary extractInfo(PDDocumentInformation info) {
        if (info == null) {
            return null;
        }
        return new PdfInfoDictionary(
                info.getTitle(),
                info.getAuthor(),
                info.getSubject(),
                info.getKeywords(),
                info.getCreator(),
                info.getProducer(),
                formatCalendar(info.getCreationDate()),
                formatCalendar(info.getModificationDate())
        );
    }

    /**
     * Parses the catalog's XMP packet leniently. A broken packet is logged and dropped.
     *
     * @param catalog document catalog
     * @return XMP values or {@code null} when absent or unreadable
     */
    private PdfXmpMetadata extractXmp(PDDocumentCatalog catalog) {
        PDMetadata pdMetadata = catalog != null ? catalog.getMetadata() : null;
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();

            List<String> creators = dc != null && dc.getCreators() != null ? dc.getCreators() : List.of();
            return new PdfXmpMetadata(
                    dc != null ? dc.getTitle() : null,
                    creators.isEmpty() ? null : String.join(", ", creators),
                    basic != null ? formatCalendar(basic.getCreateDate()) : null,
                    basic != null ? basic.getCreatorTool() : null
            );
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneId.systemDefault()));
    }
}
