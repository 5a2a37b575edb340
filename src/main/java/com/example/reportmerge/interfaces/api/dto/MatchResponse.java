package com.example.reportmerge.interfaces.api.dto;

import com.example.reportmerge.domain.model.ArticleMetadata;
import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.MatchResult;
import com.example.reportmerge.domain.model.ReportRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of {@code POST /api/match}. {@code pass}, {@code passName} and {@code reportIndex}
 * are omitted when nothing matched; {@code article} is always present.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchResponse(
        boolean matched,
        Integer pass,
        String passName,
        Integer reportIndex,
        ArticleMetadata article
) {

    public static MatchResponse of(MatchResult result, ArticleMetadata article) {
        return new MatchResponse(
                result.isMatched(),
                result.pass().map(MatchPass::number).orElse(null),
                result.pass().map(Enum::name).orElse(null),
                result.report().map(ReportRecord::index).orElse(null),
                article
        );
    }
}
