package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One metadata record ("report") of the source corpus.
 * The raw JSON is kept as-is because field shapes vary between corpora; the
 * accessors below read it without ever modifying it. {@code index} is the
 * record's position in the corpus and serves as its stable key within a run.
 *
 * @param index  position of the record in the corpus
 * @param source raw JSON of the record
 */
public record ReportRecord(int index, JsonNode source) {

    public ReportRecord {
        source = source == null ? MissingNode.getInstance() : source;
    }

    /**
     * @return the record identifier rendered as text, when present and non-empty
     */
    public Optional<String> reliefwebId() {
        JsonNode id = source.path("reliefweb_id");
        if (!id.isValueNode() || id.isNull()) {
            return Optional.empty();
        }
        String text = id.asText();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * @return the title when the record carries a textual one
     */
    public Optional<String> title() {
        JsonNode title = source.path("title");
        return title.isTextual() ? Optional.of(title.asText()) : Optional.empty();
    }

    /**
     * Reads the file descriptors, skipping entries that are not JSON objects.
     *
     * @return descriptors in record order, empty when the record lists none
     */
    public List<ReportFile> files() {
        JsonNode files = source.path("files");
        if (!files.isArray()) {
            return List.of();
        }
        List<ReportFile> descriptors = new ArrayList<>();
        for (JsonNode file : files) {
            if (file.isObject()) {
                descriptors.add(new ReportFile(textOrEmpty(file.path("saved_filename")), textOrEmpty(file.path("filename"))));
            }
        }
        return descriptors;
    }

    private static String textOrEmpty(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : "";
    }
}
