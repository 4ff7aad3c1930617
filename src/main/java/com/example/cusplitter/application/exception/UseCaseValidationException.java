package com.example.cusplitter.application.exception;

/**
 * Signals validation issues detected while running a use case, e.g. an unknown certificate
 * number or an operator choice that is not among the ambiguous candidates.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
