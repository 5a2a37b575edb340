package com.example.reportmerge.application.exception;

/**
 * Signals that the input of a use case is invalid before any work is started.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
