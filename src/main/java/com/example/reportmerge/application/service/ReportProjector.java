package com.example.reportmerge.application.service;

import com.example.reportmerge.domain.model.ArticleDate;
import com.example.reportmerge.domain.model.ArticleMetadata;
import com.example.reportmerge.domain.model.ReportRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the heterogeneous field shapes of a report record into {@link ArticleMetadata}.
 * The same projection is used whether the record was matched to a PDF or not.
 */
@Component
public class ReportProjector {

    /**
     * Projects one record. The record is only read.
     *
     * @param report record to project
     * @return uniform article metadata
     */
    public ArticleMetadata project(ReportRecord report) {
        JsonNode source = report.source();
        JsonNode sources = source.has("sources") ? source.get("sources") : source.path("source");
        return new ArticleMetadata(
                text(source.path("title")),
                date(source.path("date")),
                url(source),
                names(sources),
                names(source.path("countries")),
                names(source.path("disasters")),
                language(source.path("language")),
                bodyText(source)
        );
    }

    /**
     * A list whose first element is an object is projected to the {@code name} of every element;
     * any other list is taken as already holding the values.
     *
     * @param node list field of the record
     * @return projected values, empty when the field is absent or not a list
     */
    List<String> names(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return List.of();
        }
        boolean structured = node.get(0).isObject();
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(structured ? text(element.path("name")) : scalar(element));
        }
        return values;
    }

    String language(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            return text(node.path("name"));
        }
        return scalar(node);
    }

    private ArticleDate date(JsonNode node) {
        if (!node.isObject()) {
            return ArticleDate.empty();
        }
        return new ArticleDate(text(node.path("created")), text(node.path("changed")), text(node.path("original")));
    }

    private String url(JsonNode source) {
        String url = text(source.path("url"));
        return url.isEmpty() ? text(source.path("url_alias")) : url;
    }

    private String bodyText(JsonNode source) {
        JsonNode direct = source.path("body_text");
        if (!direct.isMissingNode() && !direct.isNull()) {
            return scalar(direct);
        }
        return text(source.path("content").path("body_text"));
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : "";
    }

    private static String scalar(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
