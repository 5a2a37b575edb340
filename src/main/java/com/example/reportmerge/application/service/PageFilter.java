package com.example.reportmerge.application.service;

import com.example.reportmerge.domain.model.PageTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces the raw text of one PDF page to its body lines.
 * <p>
 * Three suppression rules apply, in order: lines whose tokens mostly echo the cells of a
 * table found on the same page, figure/table caption lines, and source attribution lines.
 * The filter is stateless and may be shared between threads.
 */
@Component
public class PageFilter {

    private static final Pattern CAPTION_PATTERN = Pattern.compile(
            "^\\s*(Figure|Fig\\.?|Table|Tabella|Tbl\\.?|Immagine|Image|Photo|Foto)\\s*\\d+",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern ATTRIBUTION_PATTERN = Pattern.compile(
            "^\\s*(Source|Fonte)\\s*:",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final double TABLE_ECHO_THRESHOLD = 0.5;

    /**
     * Filters one page.
     *
     * @param rawText page text in reading order, may be {@code null}
     * @param tables  tables found on the same page, may be {@code null} or empty
     * @return surviving trimmed, non-empty lines in page order
     */
    public List<String> filterPage(String rawText, List<PageTable> tables) {
        if (rawText == null || rawText.isEmpty()) {
            return List.of();
        }
        Set<String> tableCells = collectTableCells(tables);

        List<String> kept = new ArrayList<>();
        rawText.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .filter(line -> tableCells.isEmpty() || !echoesTable(line, tableCells))
                .filter(line -> !isCaption(line))
                .filter(line -> !isAttribution(line))
                .forEach(kept::add);
        return kept;
    }

    /**
     * Checks whether more than half of the line's whitespace-separated tokens equal a table cell.
     *
     * @param line       trimmed candidate line
     * @param tableCells distinct trimmed cell strings of the page
     * @return {@code true} when the line is treated as table content
     */
    boolean echoesTable(String line, Set<String> tableCells) {
        String[] tokens = WHITESPACE.split(line.strip());
        if (tokens.length == 0 || (tokens.length == 1 && tokens[0].isEmpty())) {
            return false;
        }
        int hits = 0;
        for (String token : tokens) {
            if (tableCells.contains(token)) {
                hits++;
            }
        }
        return (double) hits / tokens.length > TABLE_ECHO_THRESHOLD;
    }

    boolean isCaption(String line) {
        return CAPTION_PATTERN.matcher(line).find();
    }

    boolean isAttribution(String line) {
        return ATTRIBUTION_PATTERN.matcher(line).find();
    }

    private Set<String> collectTableCells(List<PageTable> tables) {
        if (tables == null || tables.isEmpty()) {
            return Set.of();
        }
        Set<String> cells = new HashSet<>();
        for (PageTable table : tables) {
            if (table != null) {
                cells.addAll(table.cellTexts());
            }
        }
        return cells;
    }
}
