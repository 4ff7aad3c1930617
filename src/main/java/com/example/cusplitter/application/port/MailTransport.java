package com.example.cusplitter.application.port;

/**
 * Sends one message carrying one attachment.
 * Implementations report failures through {@link TransportResult} instead of throwing.
 */
public interface MailTransport {

    TransportResult send(String recipientEmail,
                         String subject,
                         String htmlBody,
                         byte[] attachmentBytes,
                         String attachmentFilename);

    /**
     * Checks that the mail server accepts a connection with the configured credentials.
     *
     * @return success, or the reason the server could not be reached
     */
    TransportResult checkConnection();
}
