package com.example.cusplitter.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures (PDF, CSV, IO).
 * Keeps PDFBox and parsing errors out of the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
