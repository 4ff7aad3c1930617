package com.example.cusplitter.application.port;

import com.example.cusplitter.domain.model.CertificateRecord;

/**
 * Produces the standalone PDF of one certificate from the source document.
 */
public interface CertificateDocumentExporter {

    /**
     * @param record certificate whose page range is sliced out
     * @return PDF bytes
     */
    byte[] export(CertificateRecord record);
}
