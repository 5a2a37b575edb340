package com.example.reportmerge.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures: PDF parsing, JSON reading and writing, file access.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception raised by the underlying library
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
