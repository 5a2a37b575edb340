package com.example.reportmerge.application.service.matching;

import java.util.List;
import java.util.Locale;

/**
 * Derived views of a PDF base file name shared by the matching passes.
 * <p>
 * {@code .pdf} is removed wherever it occurs, not only as a suffix. For the lower-cased view
 * removal happens after lower-casing, so {@code .PDF} is stripped there too; the segment view
 * strips before lower-casing and keeps the original case.
 */
public final class PdfFileName {

    private static final String PDF_EXTENSION = ".pdf";
    private static final int MIN_TITLE_LABEL_LENGTH = 10;

    private final String name;
    private final String lowerName;
    private final String lowerBaseName;
    private final List<String> segments;

    private PdfFileName(String name) {
        this.name = name;
        this.lowerName = name.toLowerCase(Locale.ROOT);
        this.lowerBaseName = lowerName.replace(PDF_EXTENSION, "");
        this.segments = List.of(name.replace(PDF_EXTENSION, "").split("_", -1));
    }

    public static PdfFileName of(String name) {
        return new PdfFileName(name == null ? "" : name);
    }

    public String name() {
        return name;
    }

    public String lowerName() {
        return lowerName;
    }

    public String lowerBaseName() {
        return lowerBaseName;
    }

    /**
     * @return underscore-delimited segments of the extension-stripped name, empty segments kept
     */
    public List<String> segments() {
        return segments;
    }

    /**
     * @return first segment, the candidate record identifier
     */
    public String leadingSegment() {
        return segments.get(0);
    }

    /**
     * Label compared against record titles: the name without its two leading identifier
     * segments when it has at least three, otherwise the whole extension-stripped name,
     * reduced to lowercase letters and digits.
     *
     * @return normalized label, possibly empty
     */
    public String normalizedTitleLabel() {
        String label = segments.size() >= 3
                ? String.join("_", segments.subList(2, segments.size()))
                : String.join("_", segments);
        return normalize(label);
    }

    /**
     * @return {@code true} when the title label is long enough to be trusted for containment matching
     */
    public boolean hasUsableTitleLabel() {
        return normalizedTitleLabel().length() > MIN_TITLE_LABEL_LENGTH;
    }

    /**
     * Lower-cases the value and drops every character that is not an ASCII letter or digit.
     *
     * @param value raw text
     * @return normalized text
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "");
    }

    @Override
    public String toString() {
        return name;
    }
}
