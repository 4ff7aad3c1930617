package com.example.cusplitter.domain.model;

/**
 * A confirmed pair handed to the dispatcher.
 *
 * @param record         certificate to send
 * @param recipientEmail destination address
 */
public record DeliveryRequest(CertificateRecord record, String recipientEmail) {

    public DeliveryRequest {
        if (record == null) {
            throw new IllegalArgumentException("Certificate is required");
        }
        if (recipientEmail == null || recipientEmail.isBlank()) {
            throw new IllegalArgumentException("Recipient email is required");
        }
        recipientEmail = recipientEmail.strip();
    }

    public DeliveryKey key() {
        return DeliveryKey.of(record, recipientEmail);
    }
}
