package com.example.reportmerge.domain.exception;

/**
 * Raised when an extraction request arrives without a PDF payload.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("A PDF file is required for text extraction.");
    }
}
