package com.example.reportmerge.application.exception;

/**
 * Base unchecked exception for failures of an application use case, such as a
 * processing request that cannot be carried out on the folder it names.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
