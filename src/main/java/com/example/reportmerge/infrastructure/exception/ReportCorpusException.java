package com.example.reportmerge.infrastructure.exception;

/**
 * Signals that a report corpus or a merged output document could not be read or written.
 */
public class ReportCorpusException extends InfrastructureException {

	/**
	 * @param message description of the failed operation
	 * @param cause   Jackson or I/O failure
	 */
    public ReportCorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
