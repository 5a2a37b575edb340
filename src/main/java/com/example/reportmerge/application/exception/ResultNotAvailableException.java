package com.example.reportmerge.application.exception;

/**
 * Thrown when the output of a job is requested before it was written, or after it was removed.
 */
public class ResultNotAvailableException extends ApplicationException {

	/**
	 * @param jobId job whose output was requested
	 */
    public ResultNotAvailableException(String jobId) {
        super("Output file not found for job " + jobId);
    }
}
