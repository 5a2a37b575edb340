package com.example.reportmerge.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identifier of a newly submitted processing job.
 */
public record JobSubmissionResponse(@JsonProperty("job_id") String jobId) {
}
