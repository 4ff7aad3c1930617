package com.example.cusplitter.application.port;

/**
 * Answer of a {@link MailTransport} for one message.
 *
 * @param success       whether the message was accepted
 * @param failureReason human readable reason, present iff {@code success} is false
 */
public record TransportResult(boolean success, String failureReason) {

    public static TransportResult sent() {
        return new TransportResult(true, null);
    }

    public static TransportResult failed(String reason) {
        return new TransportResult(false, reason);
    }
}
