package com.example.cusplitter.domain.model;

import java.util.Locale;

/**
 * Identity of a (certificate, recipient) pair across dispatch runs of the same document.
 * Email addresses are compared case-insensitively.
 */
public record DeliveryKey(int startPage, int endPage, String recipientEmail) {

    public DeliveryKey {
        if (recipientEmail == null || recipientEmail.isBlank()) {
            throw new IllegalArgumentException("Recipient email is required");
        }
        recipientEmail = recipientEmail.strip().toLowerCase(Locale.ROOT);
    }

    public static DeliveryKey of(CertificateRecord record, String recipientEmail) {
        return new DeliveryKey(record.startPage(), record.endPage(), recipientEmail);
    }
}
