package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Provenance block written at the end of the merged output document.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessingMetadata(
        String processingDate,
        String sourceJson,
        String pdfDirectory,
        int totalPdfsFound,
        int totalReports,
        MatchingStatistics matchingStatistics
) {
}
