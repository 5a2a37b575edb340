package com.example.reportmerge.infrastructure.pdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the PDF files of a data folder, descending into subdirectories.
 */
@Component
public class PdfFileScanner {

    private static final Logger log = LoggerFactory.getLogger(PdfFileScanner.class);

    /**
     * Lists every regular file ending in {@code .pdf} below the directory.
     *
     * @param directory directory to scan
     * @return distinct paths sorted by path, empty when the directory does not exist
     * @throws UncheckedIOException when the directory tree cannot be walked
     */
    public List<Path> findPdfFiles(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Directory not found: {}", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".pdf"))
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to scan " + directory, ex);
        }
    }
}
