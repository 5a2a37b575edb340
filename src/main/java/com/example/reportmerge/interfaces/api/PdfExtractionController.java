package com.example.reportmerge.interfaces.api;

import com.example.reportmerge.application.exception.ProcessingRequestValidationException;
import com.example.reportmerge.application.service.DocumentMatcher;
import com.example.reportmerge.application.service.PdfTextService;
import com.example.reportmerge.application.service.ReportProjector;
import com.example.reportmerge.domain.model.ArticleMetadata;
import com.example.reportmerge.domain.model.MatchResult;
import com.example.reportmerge.domain.model.PdfExtractionResult;
import com.example.reportmerge.domain.model.ReportRecord;
import com.example.reportmerge.infrastructure.json.JsonReportStore;
import com.example.reportmerge.interfaces.api.dto.MatchRequest;
import com.example.reportmerge.interfaces.api.dto.MatchResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer REST controller exposing single-document extraction and matching.
 */
@RestController
public class PdfExtractionController {

    private final PdfTextService pdfTextService;
    private final DocumentMatcher documentMatcher;
    private final ReportProjector reportProjector;
    private final JsonReportStore reportStore;

    public PdfExtractionController(PdfTextService pdfTextService,
                                   DocumentMatcher documentMatcher,
                                   ReportProjector reportProjector,
                                   JsonReportStore reportStore) {
        this.pdfTextService = pdfTextService;
        this.documentMatcher = documentMatcher;
        this.reportProjector = reportProjector;
        this.reportStore = reportStore;
    }

    /**
     * Extracts the filtered body text and tables of an uploaded PDF.
     *
     * @param file uploaded PDF
     * @return JSON response containing the extraction result
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PdfExtractionResult> extract(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(pdfTextService.extractText(file));
    }

    /**
     * Matches one file name against the posted report records and projects the winner.
     *
     * @param request file name and records
     * @return match provenance and the projected article metadata
     */
    @PostMapping(value = "/api/match", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MatchResponse> match(@RequestBody MatchRequest request) {
        if (request == null || request.filename() == null || request.filename().isBlank()) {
            throw new ProcessingRequestValidationException("Missing filename parameter");
        }
        List<ReportRecord> reports = reportStore.toRecords(request.reports());
        MatchResult result = documentMatcher.match(request.filename(), reports);
        ArticleMetadata article = result.report()
                .map(reportProjector::project)
                .orElse(ArticleMetadata.empty());
        return ResponseEntity.ok(MatchResponse.of(result, article));
    }

    @GetMapping(value = "/api/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "online");
        body.put("message", "Report merge API is running");
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
