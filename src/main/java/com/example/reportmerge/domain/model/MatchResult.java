package com.example.reportmerge.domain.model;

import java.util.Optional;

/**
 * Outcome of matching one PDF file name against the report records.
 * Either references exactly one record together with the pass that found it, or is {@link #none()}.
 */
public final class MatchResult {

    private static final MatchResult NONE = new MatchResult(null, null);

    private final ReportRecord report;
    private final MatchPass pass;

    private MatchResult(ReportRecord report, MatchPass pass) {
        this.report = report;
        this.pass = pass;
    }

    public static MatchResult of(ReportRecord report, MatchPass pass) {
        if (report == null || pass == null) {
            throw new IllegalArgumentException("A match needs both a report and the pass that produced it");
        }
        return new MatchResult(report, pass);
    }

    public static MatchResult none() {
        return NONE;
    }

    public boolean isMatched() {
        return report != null;
    }

    public Optional<ReportRecord> report() {
        return Optional.ofNullable(report);
    }

    public Optional<MatchPass> pass() {
        return Optional.ofNullable(pass);
    }

    @Override
    public String toString() {
        return isMatched()
                ? "MatchResult[report=" + report.index() + ", pass=" + pass.number() + "]"
                : "MatchResult[none]";
    }
}
