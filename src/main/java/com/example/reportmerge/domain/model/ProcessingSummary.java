package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Summary of a finished merge run, returned to the job that started it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessingSummary(
        String outputPath,
        int totalArticles,
        int articlesWithPdf,
        int articlesWithoutPdf,
        int totalPdfsProcessed,
        MatchingStatistics matchingStatistics
) {
}
