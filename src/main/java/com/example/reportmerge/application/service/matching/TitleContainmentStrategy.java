package com.example.reportmerge.application.service.matching;

import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.ReportRecord;

import java.util.List;
import java.util.Optional;

/**
 * Pass 5, the fallback: the normalized file name label and a normalized record title contain
 * one another, in either direction. Only used when the label is longer than ten characters.
 * Records whose title normalizes to the empty string (no ASCII letters or digits) are skipped,
 * so such a title never matches any file name.
 */
public class TitleContainmentStrategy implements MatchStrategy {

    @Override
    public MatchPass pass() {
        return MatchPass.TITLE_CONTAINMENT;
    }

    @Override
    public Optional<ReportRecord> find(PdfFileName fileName, List<ReportRecord> reports) {
        if (!fileName.hasUsableTitleLabel()) {
            return Optional.empty();
        }
        String label = fileName.normalizedTitleLabel();
        for (ReportRecord report : reports) {
            Optional<String> title = report.title().map(PdfFileName::normalize);
            if (title.isEmpty() || title.get().isEmpty()) {
                continue;
            }
            if (title.get().contains(label) || label.contains(title.get())) {
                return Optional.of(report);
            }
        }
        return Optional.empty();
    }
}
