package com.example.cusplitter.domain.model;

/**
 * Descriptive metadata of the uploaded bulk document, useful to recognise the payroll vendor.
 */
public record SourceDocumentMetadata(
        String title,
        String author,
        String creator,
        String producer,
        String creationDate,
        String pdfVersion,
        boolean encrypted,
        long fileSizeBytes
) {
}
