package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Flat, uniform projection of a report record's heterogeneous metadata fields.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArticleMetadata(
        String title,
        ArticleDate date,
        String url,
        List<String> sources,
        List<String> countries,
        List<String> disasters,
        String language,
        String bodyText
) {

    private static final ArticleMetadata EMPTY =
            new ArticleMetadata("", ArticleDate.empty(), "", List.of(), List.of(), List.of(), "", "");

    public ArticleMetadata {
        title = title == null ? "" : title;
        date = date == null ? ArticleDate.empty() : date;
        url = url == null ? "" : url;
        sources = sources == null ? List.of() : List.copyOf(sources);
        countries = countries == null ? List.of() : List.copyOf(countries);
        disasters = disasters == null ? List.of() : List.copyOf(disasters);
        language = language == null ? "" : language;
        bodyText = bodyText == null ? "" : bodyText;
    }

    /**
     * Projection used for PDFs that matched no record.
     *
     * @return metadata with every field empty and all date sub-fields present
     */
    public static ArticleMetadata empty() {
        return EMPTY;
    }
}
