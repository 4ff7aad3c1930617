package com.example.cusplitter.domain.exception;

/**
 * Base type for failures raised by the certificate domain model.
 * Subclasses describe bad input or a broken invariant and never wrap adapter errors.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation of which rule was violated
	 */
    protected DomainException(String message) {
        super(message);
    }
}
