package com.example.cusplitter.domain.model;

/**
 * Page range of one certificate as decided by the segmenter, before any field is read.
 *
 * @param sequence  1-based position of the certificate in the document
 * @param startPage first page, 0-based
 * @param endPage   last page, 0-based and inclusive
 * @param rawText   page texts of the range joined with line breaks
 */
public record CertificateSegment(int sequence, int startPage, int endPage, String rawText) {

    public CertificateSegment {
        if (startPage < 0 || endPage < startPage) {
            throw new IllegalArgumentException("Invalid page range " + startPage + "-" + endPage);
        }
        rawText = rawText == null ? "" : rawText;
    }
}
