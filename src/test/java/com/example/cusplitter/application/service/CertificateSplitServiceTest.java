package com.example.cusplitter.application.service;

import com.example.cusplitter.config.CuSplitterProperties;
import com.example.cusplitter.domain.exception.PdfFileRequiredException;
import com.example.cusplitter.domain.exception.UnsupportedPdfFormatException;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.SplitResult;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import com.example.cusplitter.infrastructure.pdf.PdfBoxMetadataReader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering the split application service end to end on in-memory PDFs.
 */
class CertificateSplitServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final CertificateSplitService service = new CertificateSplitService(
            new CertificateSegmenter(CuSplitterProperties.defaults()),
            new CertificateFieldExtractor(CuSplitterProperties.defaults(), CLOCK),
            new PdfBoxMetadataReader());

    /**
     * Verifies that a three-page document with two headers yields two certificates.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void splitFindsCertificatesAndTheirFields() throws Exception {
        byte[] pdfBytes = createPdf(List.of(
                List.of("CERTIFICAZIONE UNICA 2024", "DATI RELATIVI AL DIPENDENTE",
                        "Codice fiscale RSSMRA80A01H501U", "Cognome ROSSI", "Nome MARIO"),
                List.of("Dati fiscali e previdenziali"),
                List.of("CERTIFICAZIONE UNICA 2024", "DATI RELATIVI AL DIPENDENTE",
                        "Cognome VERDI", "Nome GIUSEPPE")));
        MockMultipartFile file = new MockMultipartFile("file", "cu-2024.pdf", "application/pdf", pdfBytes);

        SplitResult result = service.split(file);

        assertThat(result.fileName()).isEqualTo("cu-2024.pdf");
        assertThat(result.pageCount()).isEqualTo(3);
        assertThat(result.documentMetadata()).isNotNull();
        assertThat(result.records()).hasSize(2);

        CertificateRecord first = result.records().get(0);
        assertThat(first.startPage()).isZero();
        assertThat(first.endPage()).isEqualTo(1);
        assertThat(first.fiscalCode()).isEqualTo("RSSMRA80A01H501U");
        assertThat(first.surname()).isEqualTo("ROSSI");
        assertThat(first.givenName()).isEqualTo("MARIO");
        assertThat(first.taxYear()).isEqualTo(2024);

        CertificateRecord second = result.records().get(1);
        assertThat(second.startPage()).isEqualTo(2);
        assertThat(second.endPage()).isEqualTo(2);
        assertThat(second.surname()).isEqualTo("VERDI");
        assertThat(second.fiscalCode()).isNull();
        assertThat(result.warnings()).containsExactly("Certificate 2 (pages 3-3): no valid fiscal code found.");
    }

    /**
     * Ensures a document without any header produces no certificates and a warning.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void splitWarnsWhenNoHeaderIsPresent() throws Exception {
        byte[] pdfBytes = createPdf(List.of(List.of("Estratto conto"), List.of("Pagina due")));

        SplitResult result = service.split(pdfBytes, "statement.pdf");

        assertThat(result.records()).isEmpty();
        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(result.warnings()).hasSize(1);
    }

    /**
     * Ensures non-PDF uploads are rejected.
     */
    @Test
    void splitRejectsNonPdf() {
        MockMultipartFile file = new MockMultipartFile(
                "file",
                "roster.csv",
                "text/csv",
                "Cognome;Nome".getBytes(StandardCharsets.UTF_8)
        );

        assertThrows(UnsupportedPdfFormatException.class, () -> service.split(file));
    }

    /**
     * Ensures empty uploads are rejected.
     */
    @Test
    void splitRequiresFile() {
        MockMultipartFile file = new MockMultipartFile("file", new byte[0]);

        assertThrows(PdfFileRequiredException.class, () -> service.split(file));
    }

    @Test
    void splitReportsUnreadablePdf() {
        MockMultipartFile file = new MockMultipartFile("file", "broken.pdf", "application/pdf",
                "not a pdf at all".getBytes(StandardCharsets.UTF_8));

        assertThrows(PdfProcessingException.class, () -> service.split(file));
    }

    /**
     * Creates an in-memory PDF, one list of text lines per page.
     *
     * @param pages lines of each page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    private byte[] createPdf(List<List<String>> pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.A4);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    contentStream.newLineAtOffset(72, 750);
                    for (String line : lines) {
                        contentStream.showText(line);
                        contentStream.newLineAtOffset(0, -24);
                    }
                    contentStream.endText();
                }
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
