package com.example.reportmerge.interfaces.api;

import com.example.reportmerge.application.exception.ProcessingRequestValidationException;
import com.example.reportmerge.application.exception.ResultNotAvailableException;
import com.example.reportmerge.application.exception.SourceCorpusMissingException;
import com.example.reportmerge.application.service.FolderCatalogService;
import com.example.reportmerge.application.service.ProcessingJobService;
import com.example.reportmerge.domain.exception.FolderNotFoundException;
import com.example.reportmerge.domain.exception.JobNotFoundException;
import com.example.reportmerge.domain.model.FolderInfo;
import com.example.reportmerge.domain.model.JobState;
import com.example.reportmerge.domain.model.JobStatus;
import com.example.reportmerge.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProcessingController.class)
@Import(GlobalExceptionHandler.class)
class ProcessingControllerApiTests {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProcessingJobService processingJobService;

    @MockBean
    private FolderCatalogService folderCatalogService;

    @TempDir
    Path tempDir;

    @Test
    void processReturnsJobId() throws Exception {
        BDDMockito.given(processingJobService.submit("/data/haiti"))
                .willReturn(job(JobState.QUEUED, 0, "Queued"));

        mockMvc.perform(post("/api/process").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"folder_path\": \"/data/haiti\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("process_20240301_101530_1"));
    }

    @Test
    void processWithoutFolderIsRejected() throws Exception {
        BDDMockito.given(processingJobService.submit(null))
                .willThrow(new ProcessingRequestValidationException("Missing folder_path parameter"));

        mockMvc.perform(post("/api/process").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Missing folder_path parameter"));
    }

    @Test
    void processUnknownFolderIsNotFound() throws Exception {
        BDDMockito.given(processingJobService.submit("/nope"))
                .willThrow(new FolderNotFoundException("/nope"));

        mockMvc.perform(post("/api/process").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"folder_path\": \"/nope\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void statusReturnsSnapshot() throws Exception {
        BDDMockito.given(processingJobService.status("process_20240301_101530_1"))
                .willReturn(job(JobState.PROCESSING, 33, "Processing PDF 2/5: a.pdf..."));

        mockMvc.perform(get("/api/process/status/process_20240301_101530_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("process_20240301_101530_1"))
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.progress").value(33))
                .andExpect(jsonPath("$.folder_path").value("/data/haiti"))
                .andExpect(jsonPath("$.summary").doesNotExist());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        BDDMockito.given(processingJobService.status("missing"))
                .willThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/api/process/status/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void downloadStreamsResultAsAttachment() throws Exception {
        Path output = Files.writeString(tempDir.resolve("haiti_reports_full_text.json"), "{\"articles\": []}");
        BDDMockito.given(processingJobService.resultFile("job")).willReturn(output);

        mockMvc.perform(get("/api/process/download/job"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("filename=\"haiti_reports_full_text.json\"")))
                .andExpect(content().json("{\"articles\": []}"));
    }

    @Test
    void downloadBeforeCompletionIsNotFound() throws Exception {
        BDDMockito.given(processingJobService.resultFile("job")).willThrow(new ResultNotAvailableException("job"));

        mockMvc.perform(get("/api/process/download/job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("RESULT_NOT_AVAILABLE"));
    }

    @Test
    void applicationFailureIsUnprocessable() throws Exception {
        BDDMockito.given(processingJobService.resultFile("job"))
                .willThrow(new SourceCorpusMissingException("/data/haiti", "_reports.json"));

        mockMvc.perform(get("/api/process/download/job"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("APPLICATION_ERROR"));
    }

    @Test
    void unexpectedFailureIsServerError() throws Exception {
        BDDMockito.given(processingJobService.status("job")).willThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/process/status/job"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("UNEXPECTED_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/process/status/job"));
    }

    @Test
    void foldersAreListed() throws Exception {
        BDDMockito.given(folderCatalogService.listFolders("/data"))
                .willReturn(List.of(new FolderInfo("haiti", "/data/haiti", true, true, 7,
                        "haiti_reports.json", false, null)));

        mockMvc.perform(get("/api/folders").param("base_dir", "/data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("haiti"))
                .andExpect(jsonPath("$[0].pdf_count").value(7))
                .andExpect(jsonPath("$[0].json_file").value("haiti_reports.json"))
                .andExpect(jsonPath("$[0].already_processed").value(false));
    }

    private static JobStatus job(JobState state, int progress, String message) {
        return new JobStatus("process_20240301_101530_1", "/data/haiti", state, progress, message, NOW, NOW, null);
    }
}
