package com.example.cusplitter.domain.model;

import com.example.cusplitter.domain.support.NameNormalizer;

/**
 * A known recipient from the externally supplied roster.
 */
public record RosterEntry(String surname, String givenName, String fiscalCode, String email) {

    /**
     * Builds an entry applying the same normalization used for certificates.
     */
    public static RosterEntry of(String surname, String givenName, String fiscalCode, String email) {
        String trimmedEmail = email == null || email.isBlank() ? null : email.strip();
        return new RosterEntry(
                NameNormalizer.normalize(surname),
                NameNormalizer.normalize(givenName),
                NameNormalizer.normalizeFiscalCode(fiscalCode),
                trimmedEmail
        );
    }

    public boolean hasFiscalCode() {
        return fiscalCode != null && !fiscalCode.isBlank();
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public String fullName() {
        StringBuilder builder = new StringBuilder();
        if (surname != null) {
            builder.append(surname);
        }
        if (givenName != null) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(givenName);
        }
        return builder.toString();
    }
}
