package com.example.reportmerge.domain.exception;

/**
 * Raised when an uploaded file is neither named nor typed as a PDF.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName name supplied by the client, may be {@code null}
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF documents can be extracted" + (fileName != null ? ": " + fileName : "."));
    }
}
