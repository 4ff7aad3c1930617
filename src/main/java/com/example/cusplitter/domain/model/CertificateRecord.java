package com.example.cusplitter.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One certificate of the bulk document together with the subject fields read from its text.
 * Absent fields are {@code null}; names and fiscal code are already normalized.
 *
 * @param sequence   1-based position of the certificate in the document
 * @param startPage  first page, 0-based
 * @param endPage    last page, 0-based and inclusive
 * @param rawText    concatenated page text
 * @param surname    subject surname
 * @param givenName  subject given name
 * @param fiscalCode subject fiscal code, only set when the check letter was valid
 * @param taxYear    year printed on the certificate
 */
public record CertificateRecord(
        int sequence,
        int startPage,
        int endPage,
        @JsonIgnore String rawText,
        String surname,
        String givenName,
        String fiscalCode,
        Integer taxYear
) {

    public CertificateRecord {
        if (startPage < 0 || endPage < startPage) {
            throw new IllegalArgumentException("Invalid page range " + startPage + "-" + endPage);
        }
        rawText = rawText == null ? "" : rawText;
    }

    public boolean hasFiscalCode() {
        return fiscalCode != null && !fiscalCode.isBlank();
    }

    public boolean hasName() {
        return (surname != null && !surname.isBlank()) || (givenName != null && !givenName.isBlank());
    }

    /**
     * @return surname and given name joined by a space, skipping absent parts
     */
    public String fullName() {
        StringBuilder builder = new StringBuilder();
        if (surname != null && !surname.isBlank()) {
            builder.append(surname);
        }
        if (givenName != null && !givenName.isBlank()) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(givenName);
        }
        return builder.toString();
    }

    public int pageCount() {
        return endPage - startPage + 1;
    }

    /**
     * @return 1-based page range for display, e.g. {@code 4-6}
     */
    public String displayPages() {
        return (startPage + 1) + "-" + (endPage + 1);
    }
}
