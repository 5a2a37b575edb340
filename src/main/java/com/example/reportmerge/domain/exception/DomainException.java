package com.example.reportmerge.domain.exception;

/**
 * Base type for domain-level failures: a request names a PDF, folder or job that
 * the domain rules reject or cannot resolve.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation of which rule was violated
	 */
    protected DomainException(String message) {
        super(message);
    }
}
