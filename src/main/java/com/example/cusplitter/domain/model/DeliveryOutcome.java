package com.example.cusplitter.domain.model;

import java.time.Instant;

/**
 * Audit entry for one (certificate, recipient) pair of a dispatch batch.
 * The status leaves {@link DeliveryStatus#PENDING} exactly once and is never reverted.
 */
public final class DeliveryOutcome {

    private final DeliveryKey key;
    private final int certificateSequence;
    private final String recipientEmail;
    private final String attachmentFilename;
    private DeliveryStatus status;
    private String subject;
    private String failureReason;
    private Instant timestamp;

    private DeliveryOutcome(DeliveryKey key,
                            int certificateSequence,
                            String recipientEmail,
                            String attachmentFilename,
                            Instant createdAt) {
        this.key = key;
        this.certificateSequence = certificateSequence;
        this.recipientEmail = recipientEmail;
        this.attachmentFilename = attachmentFilename;
        this.status = DeliveryStatus.PENDING;
        this.timestamp = createdAt;
    }

    /**
     * Creates the pending entry recorded when a batch starts processing a pair.
     */
    public static DeliveryOutcome pending(DeliveryRequest request, String attachmentFilename, Instant createdAt) {
        return new DeliveryOutcome(request.key(), request.record().sequence(), request.recipientEmail(),
                attachmentFilename, createdAt);
    }

    public synchronized void markSent(String subject, Instant at) {
        transition(DeliveryStatus.SENT, subject, null, at);
    }

    public synchronized void markFailed(String subject, String reason, Instant at) {
        transition(DeliveryStatus.FAILED, subject, reason == null || reason.isBlank() ? "Unknown error" : reason, at);
    }

    private void transition(DeliveryStatus target, String subject, String reason, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Delivery to " + recipientEmail + " is already " + status);
        }
        this.status = target;
        this.subject = subject;
        this.failureReason = reason;
        this.timestamp = at;
    }

    public DeliveryKey getKey() {
        return key;
    }

    public int getCertificateSequence() {
        return certificateSequence;
    }

    public String getRecipientEmail() {
        return recipientEmail;
    }

    public String getAttachmentFilename() {
        return attachmentFilename;
    }

    public synchronized DeliveryStatus getStatus() {
        return status;
    }

    public synchronized String getSubject() {
        return subject;
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    public synchronized Instant getTimestamp() {
        return timestamp;
    }
}
