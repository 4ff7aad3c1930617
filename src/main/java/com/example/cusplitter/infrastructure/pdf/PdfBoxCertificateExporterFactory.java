package com.example.cusplitter.infrastructure.pdf;

import com.example.cusplitter.application.port.CertificateDocumentExporter;
import org.springframework.stereotype.Component;

/**
 * Creates the exporter for the document currently held by a workspace.
 */
@Component
public class PdfBoxCertificateExporterFactory {

    public CertificateDocumentExporter exporterFor(byte[] sourcePdf) {
        return new PdfBoxCertificateExporter(sourcePdf);
    }
}
