package com.example.reportmerge.application.service.matching;

import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.ReportFile;
import com.example.reportmerge.domain.model.ReportRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pass 2: names compared with every {@code .pdf} occurrence removed, ignoring case.
 */
public class FilenameWithoutExtensionStrategy implements MatchStrategy {

    @Override
    public MatchPass pass() {
        return MatchPass.FILENAME_WITHOUT_EXTENSION;
    }

    @Override
    public Optional<ReportRecord> find(PdfFileName fileName, List<ReportRecord> reports) {
        for (ReportRecord report : reports) {
            for (ReportFile file : report.files()) {
                String saved = file.effectiveName();
                if (saved.isEmpty()) {
                    continue;
                }
                String savedBase = saved.replace(".pdf", "").toLowerCase(Locale.ROOT);
                if (savedBase.equals(fileName.lowerBaseName())) {
                    return Optional.of(report);
                }
            }
        }
        return Optional.empty();
    }
}
