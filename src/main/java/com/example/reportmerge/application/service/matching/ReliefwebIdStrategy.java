package com.example.reportmerge.application.service.matching;

import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.ReportRecord;

import java.util.List;
import java.util.Optional;

/**
 * Pass 4: the record identifier equals the PDF name's first underscore segment exactly.
 */
public class ReliefwebIdStrategy implements MatchStrategy {

    @Override
    public MatchPass pass() {
        return MatchPass.RELIEFWEB_ID;
    }

    @Override
    public Optional<ReportRecord> find(PdfFileName fileName, List<ReportRecord> reports) {
        String candidate = fileName.leadingSegment();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        return reports.stream()
                .filter(report -> report.reliefwebId().map(candidate::equals).orElse(false))
                .findFirst();
    }
}
