package com.example.reportmerge.interfaces.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code POST /api/match}: a PDF base name and the report records to search.
 */
public record MatchRequest(String filename, JsonNode reports) {
}
