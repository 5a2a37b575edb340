package com.example.reportmerge.application.service.matching;

import com.example.reportmerge.domain.model.MatchPass;
import com.example.reportmerge.domain.model.ReportRecord;

import java.util.List;
import java.util.Optional;

/**
 * One matching pass. Implementations are pure: they only read the records, never modify them,
 * and return the first record in input order that satisfies their rule.
 */
public interface MatchStrategy {

    /**
     * @return the pass this strategy implements
     */
    MatchPass pass();

    /**
     * @param fileName PDF file name to match
     * @param reports  candidate records in input order
     * @return the first matching record, or empty when this pass finds none
     */
    Optional<ReportRecord> find(PdfFileName fileName, List<ReportRecord> reports);
}
