package com.example.reportmerge.application.service.matching;

import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.ReportFile;
import com.example.reportmerge.domain.model.ReportRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pass 1: a file descriptor's effective name equals the PDF name, ignoring case.
 */
public class ExactFilenameStrategy implements MatchStrategy {

    @Override
    public MatchPass pass() {
        return MatchPass.EXACT_FILENAME;
    }

    @Override
    public Optional<ReportRecord> find(PdfFileName fileName, List<ReportRecord> reports) {
        for (ReportRecord report : reports) {
            for (ReportFile file : report.files()) {
                String saved = file.effectiveName();
                if (!saved.isEmpty() && saved.toLowerCase(Locale.ROOT).equals(fileName.lowerName())) {
                    return Optional.of(report);
                }
            }
        }
        return Optional.empty();
    }
}
