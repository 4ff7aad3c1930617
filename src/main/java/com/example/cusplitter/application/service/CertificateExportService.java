package com.example.cusplitter.application.service;

import com.example.cusplitter.application.exception.UseCaseValidationException;
import com.example.cusplitter.application.port.CertificateDocumentExporter;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.support.CertificateFileNames;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Produces the downloadable PDFs: one certificate at a time or every certificate in one ZIP.
 */
@Service
public class CertificateExportService {

    private static final Logger log = LoggerFactory.getLogger(CertificateExportService.class);

    /**
     * @param records  certificates of the current document
     * @param sequence 1-based certificate number
     * @param exporter slices the source document
     * @return file name and PDF content
     * @throws UseCaseValidationException when no certificate has that number
     */
    public ExportedFile exportOne(List<CertificateRecord> records, int sequence, CertificateDocumentExporter exporter) {
        CertificateRecord record = records.stream()
                .filter(candidate -> candidate.sequence() == sequence)
                .findFirst()
                .orElseThrow(() -> new UseCaseValidationException("Certificate " + sequence + " does not exist."));
        return new ExportedFile(CertificateFileNames.fileNameFor(record), exporter.export(record));
    }

    /**
     * Writes every certificate into one archive. Clashing file names get a numeric suffix.
     *
     * @param records  certificates of the current document
     * @param exporter slices the source document
     * @return archive name and ZIP content
     */
    public ExportedFile exportAll(List<CertificateRecord> records, CertificateDocumentExporter exporter) {
        if (records == null || records.isEmpty()) {
            throw new UseCaseValidationException("There are no certificates to export.");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Set<String> usedNames = new HashSet<>();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (CertificateRecord record : records) {
                zip.putNextEntry(new ZipEntry(uniqueName(CertificateFileNames.fileNameFor(record), usedNames)));
                zip.write(exporter.export(record));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to build the certificate archive.", e);
        }
        log.info("Archived {} certificate(s)", records.size());
        return new ExportedFile(CertificateFileNames.archiveNameFor(records.get(0).taxYear()), out.toByteArray());
    }

    static String uniqueName(String fileName, Set<String> usedNames) {
        if (usedNames.add(fileName)) {
            return fileName;
        }
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        int suffix = 2;
        String candidate = base + "_" + suffix + extension;
        while (!usedNames.add(candidate)) {
            suffix++;
            candidate = base + "_" + suffix + extension;
        }
        return candidate;
    }

    /**
     * A generated download.
     */
    public record ExportedFile(String fileName, byte[] content) {
    }
}
