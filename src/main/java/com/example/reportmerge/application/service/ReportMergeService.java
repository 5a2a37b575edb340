package com.example.reportmerge.application.service;

import com.example.reportmerge.domain.exception.DomainException;
import com.example.reportmerge.domain.model.Article;
import com.example.reportmerge.domain.model.ArticleMetadata;
import com.example.reportmerge.domain.model.MatchResult;
import com.example.reportmerge.domain.model.MatchingStatistics;
import com.example.reportmerge.domain.model.MergedDocument;
import com.example.reportmerge.domain.model.PdfExtractionResult;
import com.example.reportmerge.domain.model.PdfTables;
import com.example.reportmerge.domain.model.ProcessingMetadata;
import com.example.reportmerge.domain.model.ProcessingSummary;
import com.example.reportmerge.domain.model.ReportCorpus;
import com.example.reportmerge.domain.model.ReportRecord;
import com.example.reportmerge.infrastructure.exception.PdfProcessingException;
import com.example.reportmerge.infrastructure.json.JsonReportStore;
import com.example.reportmerge.infrastructure.pdf.PdfFileScanner;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one merge: extracts every PDF of a folder, matches each to a report record and writes
 * the merged JSON document. Reports that no PDF matched are appended as text-less articles.
 */
@Service
public class ReportMergeService {

    private static final Logger log = LoggerFactory.getLogger(ReportMergeService.class);
    private static final int MAX_NAME_IN_PROGRESS = 50;

    private final PdfTextService pdfTextService;
    private final DocumentMatcher documentMatcher;
    private final ReportProjector reportProjector;
    private final JsonReportStore reportStore;
    private final PdfFileScanner pdfFileScanner;

    public ReportMergeService(PdfTextService pdfTextService,
                              DocumentMatcher documentMatcher,
                              ReportProjector reportProjector,
                              JsonReportStore reportStore,
                              PdfFileScanner pdfFileScanner) {
        this.pdfTextService = pdfTextService;
        this.documentMatcher = documentMatcher;
        this.reportProjector = reportProjector;
        this.reportStore = reportStore;
        this.pdfFileScanner = pdfFileScanner;
    }

    /**
     * Processes a folder end to end.
     *
     * @param sourceJson   report corpus file
     * @param pdfDirectory directory holding the PDFs, searched recursively
     * @param outputJson   file the merged document is written to
     * @param listener     progress receiver
     * @return counts describing the run
     */
    public ProcessingSummary process(Path sourceJson, Path pdfDirectory, Path outputJson, ProgressListener listener) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        report(progress, 0, "Loading source JSON...");
        ReportCorpus corpus = reportStore.readCorpus(sourceJson);

        report(progress, 5, "Scanning for PDF files...");
        List<Path> pdfFiles = pdfFileScanner.findPdfFiles(pdfDirectory);
        report(progress, 10, "Found " + pdfFiles.size() + " PDF files");

        MergedDocument document = merge(corpus, pdfFiles, sourceJson, pdfDirectory, progress);

        report(progress, 90, "Saving output JSON...");
        reportStore.write(outputJson, document);

        int withPdf = (int) document.articles().stream().filter(Article::hasPdf).count();
        ProcessingSummary summary = new ProcessingSummary(
                outputJson.toString(),
                document.documentCount(),
                withPdf,
                document.documentCount() - withPdf,
                pdfFiles.size(),
                document.processingMetadata().matchingStatistics()
        );
        report(progress, 100, "Processing complete!");
        return summary;
    }

    /**
     * Builds the merged document from an already loaded corpus and a list of PDFs.
     *
     * @param corpus       report corpus
     * @param pdfFiles     PDFs in processing order
     * @param sourceJson   corpus location, recorded as provenance
     * @param pdfDirectory PDF folder, recorded as provenance
     * @param progress     progress receiver
     * @return merged document, not yet written
     */
    MergedDocument merge(ReportCorpus corpus, List<Path> pdfFiles, Path sourceJson, Path pdfDirectory, ProgressListener progress) {
        List<ReportRecord> reports = corpus.reports();
        List<Article> articles = new ArrayList<>();
        List<PdfTables> pdfTables = new ArrayList<>();
        MatchingStatistics statistics = new MatchingStatistics();
        Set<Integer> matchedReports = new HashSet<>();

        int total = pdfFiles.size();
        for (int idx = 0; idx < total; idx++) {
            Path pdfPath = pdfFiles.get(idx);
            String pdfName = pdfPath.getFileName().toString();
            int percent = 10 + (int) ((double) idx / Math.max(total, 1) * 70);
            report(progress, percent, "Processing PDF " + (idx + 1) + "/" + total + ": " + abbreviate(pdfName) + "...");

            PdfExtractionResult extraction = extractQuietly(pdfPath, pdfName);
            if (!extraction.tables().isEmpty()) {
                pdfTables.add(new PdfTables(pdfName, extraction.tables()));
            }

            MatchResult match = documentMatcher.match(pdfName, reports);
            statistics.record(match);
            ArticleMetadata metadata = match.report()
                    .map(reportProjector::project)
                    .orElse(ArticleMetadata.empty());
            match.report().ifPresent(matched -> matchedReports.add(matched.index()));
            articles.add(Article.withPdf(pdfName, extraction.text(), metadata));
        }

        report(progress, 82, "Adding reports without PDFs...");
        for (ReportRecord report : reports) {
            if (!matchedReports.contains(report.index())) {
                articles.add(Article.withoutPdf(reportProjector.project(report)));
            }
        }

        ProcessingMetadata metadata = new ProcessingMetadata(
                LocalDateTime.now().toString(),
                String.valueOf(sourceJson),
                String.valueOf(pdfDirectory),
                total,
                reports.size(),
                statistics
        );
        log.info("Merged {} PDFs with {} reports: {}", total, reports.size(), statistics.asMap());

        JsonNode root = corpus.root();
        JsonNode event = root.path("emdat_event");
        return new MergedDocument(
                text(event, "DisNo"),
                textWithFallback(event, "disaster_type", root, "disaster"),
                textWithFallback(event, "country", root, "country"),
                textWithFallback(event, "iso2", root, "country_code"),
                text(event, "location"),
                text(event, "start_dt"),
                textWithFallback(event, "query", root, "disaster"),
                articles,
                pdfTables,
                metadata
        );
    }

    /**
     * Extracts a PDF for a batch run. A document that cannot be opened yields an empty result
     * so the remaining PDFs are still processed.
     */
    private PdfExtractionResult extractQuietly(Path pdfPath, String pdfName) {
        try {
            return pdfTextService.extractText(pdfPath);
        } catch (PdfProcessingException | DomainException ex) {
            log.warn("Error extracting text from {}: {}", pdfPath, ex.getMessage());
            return PdfExtractionResult.unreadable(pdfName, ex.getMessage());
        }
    }

    private void report(ProgressListener progress, int percent, String message) {
        log.info("[{}%] {}", percent, message);
        progress.onProgress(percent, message);
    }

    private static String abbreviate(String name) {
        return name.length() <= MAX_NAME_IN_PROGRESS ? name : name.substring(0, MAX_NAME_IN_PROGRESS);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : "";
    }

    /**
     * Reads {@code field} from the event block when the block has it, otherwise {@code fallbackField} from the root.
     */
    private static String textWithFallback(JsonNode event, String field, JsonNode root, String fallbackField) {
        return event.has(field) ? text(event, field) : text(root, fallbackField);
    }
}
