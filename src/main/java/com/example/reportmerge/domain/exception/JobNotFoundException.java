package com.example.reportmerge.domain.exception;

/**
 * Raised when a job identifier is unknown, either never issued or already evicted.
 */
public class JobNotFoundException extends DomainException {

	/**
	 * @param jobId identifier supplied by the caller
	 */
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
