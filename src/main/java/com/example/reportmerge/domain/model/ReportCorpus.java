package com.example.reportmerge.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.List;

/**
 * Parsed source corpus: the raw root document plus its report records in input order.
 *
 * @param root    root JSON object, used for the event header fields
 * @param reports records of the {@code reports} array
 */
public record ReportCorpus(JsonNode root, List<ReportRecord> reports) {

    public ReportCorpus {
        root = root == null ? MissingNode.getInstance() : root;
        reports = reports == null ? List.of() : List.copyOf(reports);
    }
}
