package com.example.cusplitter.domain.exception;

/**
 * Raised when a split is requested without a PDF to split.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("Please choose the PDF with the certificates to upload.");
    }
}
