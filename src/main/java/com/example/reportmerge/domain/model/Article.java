package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One entry of the merged output: a PDF's text joined with its report metadata,
 * or a report that no PDF was matched to.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Article(
        String pdfFilename,
        boolean hasPdf,
        String pdfText,
        int pdfTextLength,
        String title,
        ArticleDate date,
        String url,
        List<String> sources,
        List<String> countries,
        List<String> disasters,
        String language,
        String bodyText
) {

    /**
     * Builds the article for an extracted PDF.
     *
     * @param pdfFilename base name of the PDF
     * @param pdfText     assembled body text
     * @param metadata    projection of the matched record, or {@link ArticleMetadata#empty()}
     * @return article flagged as having a PDF
     */
    public static Article withPdf(String pdfFilename, String pdfText, ArticleMetadata metadata) {
        String text = pdfText == null ? "" : pdfText;
        return of(pdfFilename, true, text, metadata);
    }

    /**
     * Builds the text-less article for a report that no PDF was matched to.
     *
     * @param metadata projection of the report
     * @return article flagged as having no PDF
     */
    public static Article withoutPdf(ArticleMetadata metadata) {
        return of("", false, "", metadata);
    }

    private static Article of(String pdfFilename, boolean hasPdf, String text, ArticleMetadata metadata) {
        return new Article(
                pdfFilename == null ? "" : pdfFilename,
                hasPdf,
                text,
                text.length(),
                metadata.title(),
                metadata.date(),
                metadata.url(),
                metadata.sources(),
                metadata.countries(),
                metadata.disasters(),
                metadata.language(),
                metadata.bodyText()
        );
    }
}
