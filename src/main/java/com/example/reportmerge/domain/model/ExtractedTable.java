package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Table recorded for the output document, tagged with the page it came from.
 *
 * @param page        1-based page number
 * @param tableNumber 1-based position of the table on its page
 * @param data        cell grid as extracted
 */
public record ExtractedTable(
        int page,
        @JsonProperty("table_number") int tableNumber,
        List<List<String>> data
) {
}
