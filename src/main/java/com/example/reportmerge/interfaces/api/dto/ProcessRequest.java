package com.example.reportmerge.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/process}.
 */
public record ProcessRequest(@JsonProperty("folder_path") String folderPath) {
}
