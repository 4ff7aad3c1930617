package com.example.cusplitter.domain.support;

import com.example.cusplitter.domain.model.CertificateRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Output naming for split certificates: {@code CU<year>_<Surname>_<GivenName>_<FiscalCode>.pdf}.
 * Absent fields are left out together with their separator.
 */
public final class CertificateFileNames {

    private static final String PREFIX = "CU";
    private static final String EXTENSION = ".pdf";

    private CertificateFileNames() {
    }

    public static String fileNameFor(CertificateRecord record) {
        List<String> parts = new ArrayList<>();
        parts.add(record.taxYear() != null ? PREFIX + record.taxYear() : PREFIX);
        addIfPresent(parts, compactTitleCase(record.surname()));
        addIfPresent(parts, compactTitleCase(record.givenName()));
        addIfPresent(parts, record.fiscalCode());
        return String.join("_", parts) + EXTENSION;
    }

    /**
     * Name of the archive holding every certificate of a document.
     *
     * @param taxYear year of the first certificate, may be {@code null}
     * @return archive file name
     */
    public static String archiveNameFor(Integer taxYear) {
        return taxYear != null ? PREFIX + "_" + taxYear + "_tutte.zip" : PREFIX + "_tutte.zip";
    }

    private static String compactTitleCase(String value) {
        return NameNormalizer.toTitleCase(value).replace(" ", "");
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value);
        }
    }
}
