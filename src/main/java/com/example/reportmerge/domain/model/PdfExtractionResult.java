package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Domain DTO containing the filtered body text and the tables of one PDF.
 * Returned from {@code PdfTextService} to the merge run and to the upload endpoint.
 */
public record PdfExtractionResult(
        @JsonProperty("file_name") String fileName,
        @JsonProperty("page_count") int pageCount,
        String text,
        List<ExtractedTable> tables,
        List<PageWarning> warnings
) {

    public PdfExtractionResult {
        text = text == null ? "" : text;
        tables = tables == null ? List.of() : List.copyOf(tables);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Result used when the document itself could not be opened.
     *
     * @param fileName name of the unreadable PDF
     * @param message  failure description
     * @return text-less result carrying a single document-level warning
     */
    public static PdfExtractionResult unreadable(String fileName, String message) {
        return new PdfExtractionResult(fileName, 0, "", List.of(), List.of(new PageWarning(0, message)));
    }

    @JsonProperty("text_length")
    public int textLength() {
        return text.length();
    }
}
