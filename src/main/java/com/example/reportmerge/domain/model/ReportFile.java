package com.example.reportmerge.domain.model;

/**
 * File descriptor attached to a report record.
 *
 * @param savedFilename name the file was stored under, may be empty
 * @param filename      original file name, may be empty
 */
public record ReportFile(String savedFilename, String filename) {

    public ReportFile {
        savedFilename = savedFilename == null ? "" : savedFilename;
        filename = filename == null ? "" : filename;
    }

    /**
     * Name used for matching: the saved name when present, otherwise the original name.
     *
     * @return effective file name, empty when the descriptor names no file
     */
    public String effectiveName() {
        return savedFilename.isEmpty() ? filename : savedFilename;
    }
}
