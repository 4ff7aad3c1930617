package com.example.cusplitter.infrastructure.exception;

/**
 * Signals that a PDF could not be loaded, read or written.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
