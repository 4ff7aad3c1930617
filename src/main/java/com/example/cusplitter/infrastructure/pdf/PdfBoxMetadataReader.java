package com.example.cusplitter.infrastructure.pdf;

import com.example.cusplitter.domain.model.SourceDocumentMetadata;
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
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.List;

/**
 * Turns PDFBox metadata of the uploaded bulk document into {@link SourceDocumentMetadata}.
 * The info dictionary wins; XMP fills the fields it leaves empty.
 */
@Service
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * @param document      already opened PDF document
     * @param fileSizeBytes original upload size
     * @return structured metadata or {@code null} when the document is missing
     */
    public SourceDocumentMetadata readMetadata(PDDocument document, long fileSizeBytes) {
        if (document == null) {
            return null;
        }
        PDDocumentInformation info = document.getDocumentInformation();
        XmpFields xmp = extractXmp(document.getDocumentCatalog());

        String title = firstNonBlank(info != null ? info.getTitle() : null, xmp.title());
        String author = firstNonBlank(info != null ? info.getAuthor() : null, xmp.creators());
        String creator = firstNonBlank(info != null ? info.getCreator() : null, xmp.creatorTool());
        String producer = info != null ? info.getProducer() : null;
        String created = firstNonBlank(info != null ? formatCalendar(info.getCreationDate()) : null, xmp.createDate());

        return new SourceDocumentMetadata(
                title,
                author,
                creator,
                producer,
                created,
                String.valueOf(document.getDocument().getVersion()),
                document.isEncrypted(),
                fileSizeBytes
        );
    }

    private XmpFields extractXmp(PDDocumentCatalog catalog) {
        if (catalog == null || catalog.getMetadata() == null) {
            return XmpFields.EMPTY;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return XmpFields.EMPTY;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();

            List<String> creators = dc != null && dc.getCreators() != null ? List.copyOf(dc.getCreators()) : List.of();
            return new XmpFields(
                    dc != null ? dc.getTitle() : null,
                    creators.isEmpty() ? null : String.join(", ", creators),
                    basic != null ? basic.getCreatorTool() : null,
                    basic != null ? formatCalendar(basic.getCreateDate()) : null
            );
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return XmpFields.EMPTY;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneId.systemDefault()));
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    private record XmpFields(String title, String creators, String creatorTool, String createDate) {
        static final XmpFields EMPTY = new XmpFields(null, null, null, null);
    }
}
