package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All tables found in one PDF, as listed in the output's {@code pdf_tables} section.
 */
public record PdfTables(@JsonProperty("pdf_filename") String pdfFilename, List<ExtractedTable> tables) {
}
