package com.example.cusplitter.application.exception;

/**
 * Raised when a second dispatch batch is started while one is still running for the same workspace.
 */
public class DispatchInProgressException extends ApplicationException {

    public DispatchInProgressException() {
        super("A dispatch batch is already running. Wait for it to finish or cancel it.");
    }
}
