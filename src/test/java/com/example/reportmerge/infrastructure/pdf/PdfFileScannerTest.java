package com.example.reportmerge.infrastructure.pdf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfFileScannerTest {

    private final PdfFileScanner scanner = new PdfFileScanner();

    @TempDir
    Path root;

    @Test
    void findsPdfsRecursivelyInPathOrder() throws Exception {
        Path nested = Files.createDirectories(root.resolve("2023/june"));
        Path b = Files.createFile(root.resolve("b.pdf"));
        Path a = Files.createFile(root.resolve("a.pdf"));
        Path deep = Files.createFile(nested.resolve("c.pdf"));
        Files.createFile(root.resolve("upper.PDF"));
        Files.createFile(root.resolve("notes.txt"));
        Files.createDirectories(root.resolve("folder.pdf"));

        List<Path> files = scanner.findPdfFiles(root);

        assertThat(files).containsExactly(deep, a, b);
    }

    @Test
    void missingDirectoryYieldsNothing() {
        assertThat(scanner.findPdfFiles(root.resolve("absent"))).isEmpty();
        assertThat(scanner.findPdfFiles(null)).isEmpty();
    }
}
