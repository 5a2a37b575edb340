package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root of the merged output JSON: event header, articles, tables and provenance.
 */
@JsonPropertyOrder({"DisNo", "disaster_type", "country", "iso2", "location", "start_dt", "query",
        "articles", "n_documents", "pdf_tables", "processing_metadata"})
public record MergedDocument(
        @JsonProperty("DisNo") String disNo,
        @JsonProperty("disaster_type") String disasterType,
        @JsonProperty("country") String country,
        @JsonProperty("iso2") String iso2,
        @JsonProperty("location") String location,
        @JsonProperty("start_dt") String startDt,
        @JsonProperty("query") String query,
        @JsonProperty("articles") List<Article> articles,
        @JsonProperty("pdf_tables") List<PdfTables> pdfTables,
        @JsonProperty("processing_metadata") ProcessingMetadata processingMetadata
) {

    @JsonProperty("n_documents")
    public int documentCount() {
        return articles == null ? 0 : articles.size();
    }
}
