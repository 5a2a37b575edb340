package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Describes one data folder that can be submitted for processing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FolderInfo(
        String name,
        String path,
        boolean hasPdfs,
        boolean hasJson,
        int pdfCount,
        String jsonFile,
        boolean alreadyProcessed,
        String fullTextFile
) {
}
