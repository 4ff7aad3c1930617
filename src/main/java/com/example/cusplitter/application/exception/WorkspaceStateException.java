package com.example.cusplitter.application.exception;

/**
 * Raised when a step is requested before the step it depends on, such as reconciling before any
 * document was split or dispatching before a reconciliation exists.
 */
public class WorkspaceStateException extends UseCaseValidationException {

    public WorkspaceStateException(String message) {
        super(message);
    }
}
