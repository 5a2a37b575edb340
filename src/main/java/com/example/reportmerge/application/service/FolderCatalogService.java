package com.example.reportmerge.application.service;

import com.example.reportmerge.config.ReportMergeProperties;
import com.example.reportmerge.domain.model.FolderInfo;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the data folders below a base directory together with what each one contains.
 */
@Service
public class FolderCatalogService {

    private static final String FULL_TEXT_SUFFIX = "_full_text.json";

    private final ReportMergeProperties properties;

    public FolderCatalogService(ReportMergeProperties properties) {
        this.properties = properties;
    }

    /**
     * @param baseDir directory to list, the configured data directory when blank
     * @return one entry per subdirectory, sorted by name; empty when the directory does not exist
     */
    public List<FolderInfo> listFolders(String baseDir) {
        Path base = Path.of(baseDir == null || baseDir.isBlank() ? properties.getDataDir() : baseDir);
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        List<FolderInfo> folders = new ArrayList<>();
        for (Path folder : list(base)) {
            if (Files.isDirectory(folder)) {
                folders.add(describe(folder));
            }
        }
        return folders;
    }

    private FolderInfo describe(Path folder) {
        Path pdfDir = folder.resolve(properties.getPdfSubdirectory());
        boolean hasPdfs = Files.isDirectory(pdfDir);
        int pdfCount = hasPdfs
                ? (int) list(pdfDir).stream()
                        .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                        .count()
                : 0;
        Optional<String> jsonFile = firstNameEndingWith(folder, properties.getSourceSuffix());
        Optional<String> fullTextFile = firstNameEndingWith(folder, FULL_TEXT_SUFFIX);

        return new FolderInfo(
                folder.getFileName().toString(),
                folder.toAbsolutePath().normalize().toString(),
                hasPdfs,
                jsonFile.isPresent(),
                pdfCount,
                jsonFile.orElse(null),
                fullTextFile.isPresent(),
                fullTextFile.orElse(null)
        );
    }

    private Optional<String> firstNameEndingWith(Path folder, String suffix) {
        return list(folder).stream()
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(suffix))
                .findFirst();
    }

    private List<Path> list(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.sorted().collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list " + directory, ex);
        }
    }
}
