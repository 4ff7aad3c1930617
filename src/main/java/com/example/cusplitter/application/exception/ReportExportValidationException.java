package com.example.cusplitter.application.exception;

/**
 * Raised when a CSV report is requested but there is nothing to export.
 */
public class ReportExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public ReportExportValidationException(String message) {
        super(message);
    }
}
