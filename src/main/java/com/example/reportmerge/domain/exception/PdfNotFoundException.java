package com.example.reportmerge.domain.exception;

/**
 * Raised when a PDF path handed to the extractor does not exist.
 */
public class PdfNotFoundException extends DomainException {

	/**
	 * @param path path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("PDF not found: " + path);
    }
}
