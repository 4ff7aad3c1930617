package com.example.cusplitter.domain.model;

/**
 * Delivery state of one (certificate, recipient) pair.
 * {@code PENDING} moves once to {@code SENT} or {@code FAILED}; both are terminal.
 */
public enum DeliveryStatus {
    PENDING,
    SENT,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
