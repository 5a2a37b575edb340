package com.example.reportmerge.application.service;

import com.example.reportmerge.application.service.matching.ExactFilenameStrategy;
import com.example.reportmerge.application.service.matching.FilenameWithoutExtensionStrategy;
import com.example.reportmerge.application.service.matching.IdentifierPrefixStrategy;
import com.example.reportmerge.application.service.matching.MatchStrategy;
import com.example.reportmerge.application.service.matching.PdfFileName;
import com.example.reportmerge.application.service.matching.ReliefwebIdStrategy;
import com.example.reportmerge.application.service.matching.TitleContainmentStrategy;
import com.example.reportmerge.domain.model.MatchResult;
import com.example.reportmerge.domain.model.ReportRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Associates a PDF file name with the report record it describes.
 * <p>
 * Strategies run in order and the first one that finds a record wins; later, looser passes are
 * never consulted once an earlier one has matched. Within a pass the first record in input
 * order wins. Matching only reads the records, so one record list can be shared by any number
 * of concurrent calls as long as nobody modifies it meanwhile.
 */
@Service
public class DocumentMatcher {

    private static final Logger log = LoggerFactory.getLogger(DocumentMatcher.class);

    private final List<MatchStrategy> strategies;

    /**
     * Creates the matcher with the five standard passes.
     */
    public DocumentMatcher() {
        this(defaultStrategies());
    }

    /**
     * Creates a matcher running the given strategies in list order.
     *
     * @param strategies ordered passes
     */
    public DocumentMatcher(List<MatchStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @return the standard passes, strictest first
     */
    public static List<MatchStrategy> defaultStrategies() {
        return List.of(
                new ExactFilenameStrategy(),
                new FilenameWithoutExtensionStrategy(),
                new IdentifierPrefixStrategy(),
                new ReliefwebIdStrategy(),
                new TitleContainmentStrategy()
        );
    }

    /**
     * Matches one PDF base file name.
     *
     * @param filename PDF base name, not a path
     * @param reports  candidate records in input order, may be {@code null} or empty
     * @return the matched record with the pass that found it, or {@link MatchResult#none()}
     */
    public MatchResult match(String filename, List<ReportRecord> reports) {
        if (filename == null || reports == null || reports.isEmpty()) {
            return MatchResult.none();
        }
        PdfFileName fileName = PdfFileName.of(filename);
        for (MatchStrategy strategy : strategies) {
            Optional<ReportRecord> found = strategy.find(fileName, reports);
            if (found.isPresent()) {
                log.debug("Matched {} to report #{} via pass {}", filename, found.get().index(), strategy.pass().number());
                return MatchResult.of(found.get(), strategy.pass());
            }
        }
        log.debug("No report matched {}", filename);
        return MatchResult.none();
    }
}
