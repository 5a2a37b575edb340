package com.example.reportmerge.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Domain DTO holding one table found on a PDF page as a grid of cell strings.
 * Rows may have unequal length and individual cells may be {@code null}.
 */
public record PageTable(List<List<String>> rows) {

    public PageTable {
        if (rows == null) {
            rows = List.of();
        } else {
            List<List<String>> copy = new ArrayList<>(rows.size());
            for (List<String> row : rows) {
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
            rows = Collections.unmodifiableList(copy);
        }
    }

    /**
     * Collects every distinct trimmed cell value of the table, skipping absent cells.
     *
     * @return insertion-ordered set of cell strings
     */
    public Set<String> cellTexts() {
        Set<String> texts = new LinkedHashSet<>();
        for (List<String> row : rows) {
            for (String cell : row) {
                if (cell != null && !cell.isEmpty()) {
                    texts.add(cell.strip());
                }
            }
        }
        return texts;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
