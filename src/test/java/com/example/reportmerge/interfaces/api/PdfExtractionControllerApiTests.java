package com.example.reportmerge.interfaces.api;

import com.example.reportmerge.application.service.DocumentMatcher;
import com.example.reportmerge.application.service.PdfTextService;
import com.example.reportmerge.application.service.ReportProjector;
import com.example.reportmerge.domain.exception.PdfFileRequiredException;
import com.example.reportmerge.domain.model.PdfExtractionResult;
import com.example.reportmerge.infrastructure.exception.PdfProcessingException;
import com.example.reportmerge.infrastructure.json.JsonReportStore;
import com.example.reportmerge.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = PdfExtractionController.class)
@Import({GlobalExceptionHandler.class, DocumentMatcher.class, ReportProjector.class, JsonReportStore.class})
class PdfExtractionControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PdfTextService pdfTextService;

    @Test
    void extractReturnsTextAndTables() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sample.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(pdfTextService.extractText(BDDMockito.any(MultipartFile.class)))
                .willReturn(new PdfExtractionResult("sample.pdf", 2, "Body text.", List.of(), List.of()));

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.file_name").value("sample.pdf"))
                .andExpect(jsonPath("$.page_count").value(2))
                .andExpect(jsonPath("$.text").value("Body text."))
                .andExpect(jsonPath("$.text_length").value(10));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sample.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(pdfTextService.extractText(BDDMockito.any(MultipartFile.class)))
                .willThrow(new PdfFileRequiredException());

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sample.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(pdfTextService.extractText(BDDMockito.any(MultipartFile.class)))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"))
                .andExpect(jsonPath("$.details.exception").value("PdfProcessingException"));
    }

    @Test
    void matchReturnsPassAndProjectedArticle() throws Exception {
        String body = """
                {"filename": "12345_report.pdf",
                 "reports": [
                   {"title": "Some report", "files": []},
                   {"title": "Flash report", "files": [{"saved_filename": "12345_report.pdf"}],
                    "sources": [{"name": "OCHA"}], "body_text": "Summary."}
                 ]}
                """;

        mockMvc.perform(post("/api/match").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(true))
                .andExpect(jsonPath("$.pass").value(1))
                .andExpect(jsonPath("$.pass_name").value("EXACT_FILENAME"))
                .andExpect(jsonPath("$.report_index").value(1))
                .andExpect(jsonPath("$.article.title").value("Flash report"))
                .andExpect(jsonPath("$.article.sources[0]").value("OCHA"))
                .andExpect(jsonPath("$.article.body_text").value("Summary."));
    }

    @Test
    void matchWithoutHitReturnsEmptyArticle() throws Exception {
        String body = "{\"filename\": \"zz.pdf\", \"reports\": [{\"title\": \"Other\"}]}";

        mockMvc.perform(post("/api/match").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(false))
                .andExpect(jsonPath("$.pass").doesNotExist())
                .andExpect(jsonPath("$.article.title").value(""))
                .andExpect(jsonPath("$.article.date.created").value(""));
    }

    @Test
    void matchRequiresFilename() throws Exception {
        mockMvc.perform(post("/api/match").contentType(MediaType.APPLICATION_JSON).content("{\"reports\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/match").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void healthReportsOnline() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("online"));
    }
}
