package com.example.reportmerge.interfaces.api;

import com.example.reportmerge.application.service.FolderCatalogService;
import com.example.reportmerge.application.service.ProcessingJobService;
import com.example.reportmerge.domain.model.FolderInfo;
import com.example.reportmerge.domain.model.JobStatus;
import com.example.reportmerge.interfaces.api.dto.JobSubmissionResponse;
import com.example.reportmerge.interfaces.api.dto.ProcessRequest;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * Interfaces-layer REST controller for background folder processing.
 */
@RestController
public class ProcessingController {

    private final ProcessingJobService processingJobService;
    private final FolderCatalogService folderCatalogService;

    public ProcessingController(ProcessingJobService processingJobService, FolderCatalogService folderCatalogService) {
        this.processingJobService = processingJobService;
        this.folderCatalogService = folderCatalogService;
    }

    /**
     * Starts processing a data folder.
     *
     * @param request folder to process
     * @return identifier of the background job
     */
    @PostMapping(value = "/api/process", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobSubmissionResponse> process(@RequestBody(required = false) ProcessRequest request) {
        JobStatus job = processingJobService.submit(request == null ? null : request.folderPath());
        return ResponseEntity.ok(new JobSubmissionResponse(job.jobId()));
    }

    @GetMapping(value = "/api/process/status/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobStatus> status(@PathVariable String jobId) {
        return ResponseEntity.ok(processingJobService.status(jobId));
    }

    /**
     * Streams the merged JSON document of a completed job as a download.
     *
     * @param jobId job identifier
     * @return output file as an attachment
     */
    @GetMapping("/api/process/download/{jobId}")
    public ResponseEntity<Resource> download(@PathVariable String jobId) {
        Path output = processingJobService.resultFile(jobId);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(output.getFileName().toString())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .body(new FileSystemResource(output));
    }

    @GetMapping(value = "/api/folders", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<FolderInfo> folders(@RequestParam(name = "base_dir", required = false) String baseDir) {
        return folderCatalogService.listFolders(baseDir);
    }
}
