package com.example.reportmerge.application.service.matching;

import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.ReportFile;
import com.example.reportmerge.domain.model.ReportRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pass 3: a descriptor name starts with the PDF name's first two underscore segments, ignoring case.
 */
public class IdentifierPrefixStrategy implements MatchStrategy {

    @Override
    public MatchPass pass() {
        return MatchPass.IDENTIFIER_PREFIX;
    }

    @Override
    public Optional<ReportRecord> find(PdfFileName fileName, List<ReportRecord> reports) {
        List<String> segments = fileName.segments();
        if (segments.size() < 2) {
            return Optional.empty();
        }
        String prefix = (segments.get(0) + "_" + segments.get(1)).toLowerCase(Locale.ROOT);
        for (ReportRecord report : reports) {
            for (ReportFile file : report.files()) {
                String saved = file.effectiveName();
                if (!saved.isEmpty() && saved.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                    return Optional.of(report);
                }
            }
        }
        return Optional.empty();
    }
}
