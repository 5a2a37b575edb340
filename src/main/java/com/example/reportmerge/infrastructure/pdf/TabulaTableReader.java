package com.example.reportmerge.infrastructure.pdf;

import com.example.reportmerge.domain.model.PageTable;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that finds ruled tables on a PDF page with tabula.
 * Only the lattice (ruling line) algorithm is used; free-flowing prose is never reported as a table.
 */
@Component
public class TabulaTableReader {

    /**
     * Reads the tables of one page.
     *
     * @param document   open PDF document
     * @param pageNumber 1-based page number
     * @return tables in the order tabula reports them, empty when the page has none
     */
    public List<PageTable> readTables(PDDocument document, int pageNumber) {
        ObjectExtractor extractor = new ObjectExtractor(document);
        Page page = extractor.extract(pageNumber);
        if (page == null) {
            return List.of();
        }
        List<? extends Table> tables = new SpreadsheetExtractionAlgorithm().extract(page);
        List<PageTable> pageTables = new ArrayList<>(tables.size());
        for (Table table : tables) {
            PageTable pageTable = toPageTable(table);
            if (!pageTable.isEmpty()) {
                pageTables.add(pageTable);
            }
        }
        return pageTables;
    }

    private PageTable toPageTable(Table table) {
        List<List<String>> rows = new ArrayList<>();
        for (List<RectangularTextContainer> row : table.getRows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (RectangularTextContainer cell : row) {
                String text = cell == null ? null : cell.getText();
                // tabula joins wrapped cell lines with \r
                cells.add(text == null || text.isEmpty() ? null : text.replace('\r', ' '));
            }
            rows.add(cells);
        }
        return new PageTable(rows);
    }
}
