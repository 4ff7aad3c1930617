package com.example.cusplitter.infrastructure.exception;

/**
 * Signals that the roster CSV could not be read or has no usable header.
 */
public class RosterReadException extends InfrastructureException {

    public RosterReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
