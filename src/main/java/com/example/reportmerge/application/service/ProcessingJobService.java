package com.example.reportmerge.application.service;

import com.example.reportmerge.application.exception.ProcessingRequestValidationException;
import com.example.reportmerge.application.exception.ResultNotAvailableException;
import com.example.reportmerge.application.exception.SourceCorpusMissingException;
import com.example.reportmerge.config.ReportMergeProperties;
import com.example.reportmerge.domain.exception.FolderNotFoundException;
import com.example.reportmerge.domain.model.JobState;
import com.example.reportmerge.domain.model.JobStatus;
import com.example.reportmerge.domain.model.ProcessingSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Runs merge jobs for data folders in the background and exposes their status and output.
 * A data folder holds one {@code *_reports.json} corpus and a {@code pdfs} subdirectory; the
 * merged document is written next to the corpus.
 */
@Service
public class ProcessingJobService {

    private static final Logger log = LoggerFactory.getLogger(ProcessingJobService.class);

    private final ReportMergeService reportMergeService;
    private final ProcessingJobRegistry registry;
    private final TaskExecutor executor;
    private final ReportMergeProperties properties;

    public ProcessingJobService(ReportMergeService reportMergeService,
                                ProcessingJobRegistry registry,
                                @Qualifier("reportMergeExecutor") TaskExecutor executor,
                                ReportMergeProperties properties) {
        this.reportMergeService = reportMergeService;
        this.registry = registry;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Validates the folder and schedules its processing.
     *
     * @param folderPath data folder to process
     * @return snapshot of the registered job
     * @throws ProcessingRequestValidationException when no folder is given
     * @throws FolderNotFoundException              when the folder does not exist
     */
    public JobStatus submit(String folderPath) {
        if (folderPath == null || folderPath.isBlank()) {
            throw new ProcessingRequestValidationException("Missing folder_path parameter");
        }
        Path folder = Path.of(folderPath);
        if (!Files.exists(folder)) {
            throw new FolderNotFoundException(folderPath);
        }

        JobStatus job = registry.create(folderPath);
        try {
            executor.execute(() -> run(job.jobId(), folder));
        } catch (TaskRejectedException ex) {
            registry.fail(job.jobId(), "Processing queue is full, try again later");
        }
        return registry.require(job.jobId());
    }

    public JobStatus status(String jobId) {
        return registry.require(jobId);
    }

    /**
     * Resolves the merged document of a completed job.
     *
     * @param jobId job identifier
     * @return path of the written output file
     * @throws ResultNotAvailableException when the job has not completed or the file is gone
     */
    public Path resultFile(String jobId) {
        JobStatus status = registry.require(jobId);
        if (status.status() != JobState.COMPLETED || status.summary() == null) {
            throw new ResultNotAvailableException(jobId);
        }
        Path output = Path.of(status.summary().outputPath());
        if (!Files.isRegularFile(output)) {
            throw new ResultNotAvailableException(jobId);
        }
        return output;
    }

    /**
     * Body of a background job. Every failure ends up as an {@code ERROR} state on the job;
     * JVM errors are rethrown after the job is marked failed.
     */
    void run(String jobId, Path folder) {
        registry.start(jobId);
        try {
            Path sourceJson = findSourceCorpus(folder);
            Path pdfDirectory = folder.resolve(properties.getPdfSubdirectory());
            String corpusName = sourceJson.getFileName().toString();
            String baseName = corpusName.substring(0, corpusName.length() - properties.getSourceSuffix().length());
            Path outputJson = folder.resolve(baseName + properties.getOutputSuffix());

            log.info("[{}] Processing PDFs in {} against {}", jobId, pdfDirectory, sourceJson);
            ProcessingSummary summary = reportMergeService.process(sourceJson, pdfDirectory, outputJson,
                    (percent, message) -> registry.advance(jobId, percent, message));
            registry.complete(jobId, summary);
        } catch (RuntimeException | Error ex) {
            log.error("[{}] Processing failed", jobId, ex);
            registry.fail(jobId, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            if (ex instanceof Error) {
                throw (Error) ex;
            }
        }
    }

    /**
     * Picks the first corpus file of the folder by name.
     *
     * @param folder data folder
     * @return corpus path
     * @throws SourceCorpusMissingException when the folder holds no corpus
     */
    Path findSourceCorpus(Path folder) {
        String suffix = properties.getSourceSuffix();
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .findFirst()
                    .orElseThrow(() -> new SourceCorpusMissingException(folder.toString(), suffix));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list " + folder, ex);
        }
    }
}
