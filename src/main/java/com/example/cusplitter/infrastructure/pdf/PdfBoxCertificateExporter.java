package com.example.cusplitter.infrastructure.pdf;

import com.example.cusplitter.application.port.CertificateDocumentExporter;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.PageExtractor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;

/**
 * Slices one certificate out of the bulk document and stamps a title on the result.
 * Every call loads its own copy of the source, so one exporter can serve several dispatch workers.
 */
public class PdfBoxCertificateExporter implements CertificateDocumentExporter {

    static final String CREATOR_TOOL = "cu-splitter";

    private final byte[] sourcePdf;

    /**
     * @param sourcePdf bytes of the bulk document the records were read from
     */
    public PdfBoxCertificateExporter(byte[] sourcePdf) {
        if (sourcePdf == null || sourcePdf.length == 0) {
            throw new IllegalArgumentException("Source PDF is required");
        }
        this.sourcePdf = sourcePdf;
    }

    @Override
    public byte[] export(CertificateRecord record) {
        try (PDDocument source = Loader.loadPDF(sourcePdf)) {
            if (record.endPage() >= source.getNumberOfPages()) {
                throw new PdfProcessingException("Certificate " + record.sequence() + " refers to pages "
                        + record.displayPages() + " but the document has " + source.getNumberOfPages() + ".", null);
            }
            PageExtractor extractor = new PageExtractor(source, record.startPage() + 1, record.endPage() + 1);
            try (PDDocument certificate = extractor.extract()) {
                String title = titleFor(record);
                stampInfo(certificate, title);
                stampXmp(certificate, title);
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                certificate.save(out);
                return out.toByteArray();
            }
        } catch (IOException | TransformerException e) {
            throw new PdfProcessingException("Unable to export certificate " + record.sequence() + ".", e);
        }
    }

    private void stampInfo(PDDocument certificate, String title) {
        PDDocumentInformation info = new PDDocumentInformation();
        info.setTitle(title);
        info.setSubject("Certificazione Unica");
        info.setCreator(CREATOR_TOOL);
        info.setCreationDate(Calendar.getInstance());
        certificate.setDocumentInformation(info);
    }

    private void stampXmp(PDDocument certificate, String title) throws TransformerException, IOException {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();
        DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
        dc.setTitle(title);
        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        basic.setCreatorTool(CREATOR_TOOL);

        ByteArrayOutputStream xmpBytes = new ByteArrayOutputStream();
        new XmpSerializer().serialize(xmp, xmpBytes, true);
        PDMetadata metadata = new PDMetadata(certificate);
        metadata.importXMPMetadata(xmpBytes.toByteArray());
        certificate.getDocumentCatalog().setMetadata(metadata);
    }

    private static String titleFor(CertificateRecord record) {
        StringBuilder title = new StringBuilder("Certificazione Unica");
        if (record.taxYear() != null) {
            title.append(' ').append(record.taxYear());
        }
        if (record.hasName()) {
            title.append(" - ").append(record.fullName());
        }
        return title.toString();
    }
}
