package com.example.cusplitter.domain.model;

import java.util.List;

/**
 * Result of splitting one bulk document into certificates.
 *
 * @param fileName         original upload name
 * @param pageCount        pages in the source document
 * @param records          certificates in document order
 * @param warnings         degraded-input notices for the operator
 * @param documentMetadata metadata of the source document
 */
public record SplitResult(
        String fileName,
        int pageCount,
        List<CertificateRecord> records,
        List<String> warnings,
        SourceDocumentMetadata documentMetadata
) {

    public SplitResult {
        records = records == null ? List.of() : List.copyOf(records);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
