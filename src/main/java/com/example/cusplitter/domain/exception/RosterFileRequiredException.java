package com.example.cusplitter.domain.exception;

/**
 * Raised when reconciliation is requested without a roster file.
 */
public class RosterFileRequiredException extends DomainException {

    public RosterFileRequiredException() {
        super("Please choose the roster CSV file to upload.");
    }
}
