package com.example.cusplitter.application.service;

import com.example.cusplitter.application.port.TextPageSource;
import com.example.cusplitter.domain.exception.PdfFileRequiredException;
import com.example.cusplitter.domain.exception.UnsupportedPdfFormatException;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.CertificateSegment;
import com.example.cusplitter.domain.model.PageText;
import com.example.cusplitter.domain.model.SourceDocumentMetadata;
import com.example.cusplitter.domain.model.SplitResult;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import com.example.cusplitter.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.cusplitter.infrastructure.pdf.PdfBoxTextPageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that turns an uploaded bulk PDF into certificate records.
 * It validates the upload, reads the page text through PDFBox, then runs the segmenter and the
 * field extractor.
 */
@Service
public class CertificateSplitService {

    private static final Logger log = LoggerFactory.getLogger(CertificateSplitService.class);

    private final CertificateSegmenter segmenter;
    private final CertificateFieldExtractor fieldExtractor;
    private final PdfBoxMetadataReader metadataReader;

    public CertificateSplitService(CertificateSegmenter segmenter,
                                   CertificateFieldExtractor fieldExtractor,
                                   PdfBoxMetadataReader metadataReader) {
        this.segmenter = segmenter;
        this.fieldExtractor = fieldExtractor;
        this.metadataReader = metadataReader;
    }

    /**
     * @param file uploaded bulk document
     * @return split result
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type or name does not look like a PDF
     * @throws PdfProcessingException        when PDFBox cannot read the bytes
     */
    public SplitResult split(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        try {
            return split(file.getBytes(), resolveFileName(file));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    /**
     * Splits a document already held in memory.
     *
     * @param bytes    PDF content
     * @param fileName name shown to the operator
     * @return split result
     */
    public SplitResult split(byte[] bytes, String fileName) {
        try (PdfBoxTextPageSource source = PdfBoxTextPageSource.open(bytes)) {
            SourceDocumentMetadata metadata = metadataReader.readMetadata(source.document(), bytes.length);
            return split(source, fileName, metadata);
        }
    }

    /**
     * Reads every page of the source, then segments and extracts. A page that cannot be read
     * aborts the whole split.
     *
     * @param source   page text provider
     * @param fileName name shown to the operator
     * @param metadata metadata of the source, may be {@code null}
     * @return split result
     */
    public SplitResult split(TextPageSource source, String fileName, SourceDocumentMetadata metadata) {
        int pageCount = source.pageCount();
        List<PageText> pages = new ArrayList<>(pageCount);
        for (int index = 0; index < pageCount; index++) {
            pages.add(source.pageText(index));
        }

        CertificateSegmenter.Segmentation segmentation = segmenter.segment(pages);
        List<String> warnings = new ArrayList<>(segmentation.warnings());
        List<CertificateRecord> records = new ArrayList<>(segmentation.segments().size());
        for (CertificateSegment segment : segmentation.segments()) {
            CertificateRecord record = fieldExtractor.extract(segment);
            records.add(record);
            warnings.addAll(fieldWarnings(record));
        }

        log.info("Split '{}' ({} pages) into {} certificate(s), {} warning(s)",
                fileName, pageCount, records.size(), warnings.size());
        return new SplitResult(fileName, pageCount, records, warnings, metadata);
    }

    private List<String> fieldWarnings(CertificateRecord record) {
        List<String> warnings = new ArrayList<>(2);
        String where = "Certificate " + record.sequence() + " (pages " + record.displayPages() + ")";
        if (!record.hasFiscalCode()) {
            warnings.add(where + ": no valid fiscal code found.");
        }
        if (!record.hasName()) {
            warnings.add(where + ": no name found.");
        }
        return warnings;
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
