package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Immutable snapshot of a processing job as exposed over the API.
 * {@code summary} is only set once the job has completed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatus(
        String jobId,
        String folderPath,
        JobState status,
        int progress,
        String message,
        Instant createdAt,
        Instant updatedAt,
        ProcessingSummary summary
) {
}
