package com.example.reportmerge.infrastructure.exception;

/**
 * Signals that PDFBox could not open or read a PDF document.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the caller
	 * @param cause   PDFBox failure
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
