package com.example.cusplitter.infrastructure.pdf;

import com.example.cusplitter.domain.model.SourceDocumentMetadata;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class PdfBoxMetadataReaderTest {

    private final PdfBoxMetadataReader reader = new PdfBoxMetadataReader();

    @Test
    void xmpFillsFieldsTheInfoDictionaryLeavesEmpty() throws Exception {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            PDDocumentInformation info = new PDDocumentInformation();
            info.setAuthor("Ufficio Paghe");
            document.setDocumentInformation(info);

            XMPMetadata xmp = XMPMetadata.createXMPMetadata();
            DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
            dc.setTitle("CU 2024 dipendenti");
            XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
            basic.setCreatorTool("Zucchetti Paghe");
            ByteArrayOutputStream xmpBytes = new ByteArrayOutputStream();
            new XmpSerializer().serialize(xmp, xmpBytes, true);
            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(xmpBytes.toByteArray());
            document.getDocumentCatalog().setMetadata(metadata);

            SourceDocumentMetadata result = reader.readMetadata(document, 1234L);

            assertThat(result.title()).isEqualTo("CU 2024 dipendenti");
            assertThat(result.author()).isEqualTo("Ufficio Paghe");
            assertThat(result.creator()).isEqualTo("Zucchetti Paghe");
            assertThat(result.encrypted()).isFalse();
            assertThat(result.fileSizeBytes()).isEqualTo(1234L);
        }
    }

    @Test
    void unreadableXmpIsIgnored() throws Exception {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            PDDocumentInformation info = new PDDocumentInformation();
            info.setTitle("Certificazioni");
            document.setDocumentInformation(info);
            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata("not xmp".getBytes(StandardCharsets.UTF_8));
            document.getDocumentCatalog().setMetadata(metadata);

            SourceDocumentMetadata result = reader.readMetadata(document, 10L);

            assertThat(result.title()).isEqualTo("Certificazioni");
            assertThat(result.creator()).isNull();
        }
    }

    @Test
    void missingDocumentHasNoMetadata() {
        assertThat(reader.readMetadata(null, 0L)).isNull();
    }
}
