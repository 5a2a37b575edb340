package com.example.reportmerge.application.exception;

/**
 * Thrown when a folder processing or matching request is missing required parameters.
 */
public class ProcessingRequestValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message returned to the client
	 */
    public ProcessingRequestValidationException(String message) {
        super(message);
    }
}
