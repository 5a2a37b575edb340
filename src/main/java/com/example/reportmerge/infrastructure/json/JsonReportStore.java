package com.example.reportmerge.infrastructure.json;

import com.example.reportmerge.domain.model.ReportCorpus;
import com.example.reportmerge.domain.model.ReportRecord;
import com.example.reportmerge.infrastructure.exception.ReportCorpusException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads report corpora and writes merged output documents as UTF-8 JSON with Jackson.
 */
@Component
public class JsonReportStore {

    private static final Logger log = LoggerFactory.getLogger(JsonReportStore.class);

    private final ObjectMapper objectMapper;

    public JsonReportStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a corpus. Records keep their position in the {@code reports} array as index.
     *
     * @param path corpus file
     * @return parsed corpus, without records when the file has no {@code reports} array
     * @throws ReportCorpusException when the file cannot be read or is not JSON
     */
    public ReportCorpus readCorpus(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            throw new ReportCorpusException("Failed to load source JSON: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ReportCorpusException("Failed to load source JSON: " + path + " is not a JSON object", null);
        }
        return new ReportCorpus(root, toRecords(root.path("reports")));
    }

    /**
     * Converts a JSON array into records indexed by position.
     *
     * @param reports array node, anything else yields no records
     * @return records in array order
     */
    public List<ReportRecord> toRecords(JsonNode reports) {
        if (reports == null || !reports.isArray()) {
            return List.of();
        }
        List<ReportRecord> records = new ArrayList<>(reports.size());
        for (int i = 0; i < reports.size(); i++) {
            records.add(new ReportRecord(i, reports.get(i)));
        }
        return records;
    }

    /**
     * Writes a value as indented JSON, creating parent directories as needed.
     *
     * @param path  target file
     * @param value document to serialize
     * @throws ReportCorpusException when the file cannot be written
     */
    public void write(Path path, Object value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), value);
            log.debug("Wrote {}", path);
        } catch (IOException ex) {
            throw new ReportCorpusException("Failed to write " + path + ": " + ex.getMessage(), ex);
        }
    }
}
