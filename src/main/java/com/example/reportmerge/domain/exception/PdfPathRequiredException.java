package com.example.reportmerge.domain.exception;

/**
 * Raised when text extraction is requested for a {@code null} {@link java.nio.file.Path}.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("A PDF path is required for text extraction.");
    }
}
