package com.example.reportmerge.application.service;

import com.example.reportmerge.config.ReportMergeProperties;
import com.example.reportmerge.domain.exception.JobNotFoundException;
import com.example.reportmerge.domain.model.JobState;
import com.example.reportmerge.domain.model.JobStatus;
import com.example.reportmerge.domain.model.ProcessingSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns the status of every folder processing job.
 * <p>
 * Jobs are created on submission and change state only through {@link #start}, {@link #advance},
 * {@link #complete} and {@link #fail}. Finished jobs are evicted once they outlive the configured
 * TTL, or earlier, oldest first, when the registry grows beyond its capacity.
 */
@Component
public class ProcessingJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessingJobRegistry.class);
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Map<String, ProcessingJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final ReportMergeProperties.Jobs settings;

    public ProcessingJobRegistry(Clock clock, ReportMergeProperties properties) {
        this.clock = clock;
        this.settings = properties.getJobs();
    }

    /**
     * Registers a new job in {@link JobState#QUEUED}.
     *
     * @param folderPath folder the job will process
     * @return snapshot of the new job
     */
    public JobStatus create(String folderPath) {
        Instant now = clock.instant();
        String jobId = "process_" + ID_FORMAT.format(now.atZone(clock.getZone())) + "_" + sequence.incrementAndGet();
        ProcessingJob job = new ProcessingJob(jobId, folderPath, now);
        jobs.put(jobId, job);
        log.info("Registered job {} for {}", jobId, folderPath);
        enforceCapacity();
        return job.snapshot();
    }

    public void start(String jobId) {
        transition(jobId, job -> {
            if (job.state != JobState.QUEUED) {
                log.debug("Ignoring start of job {} in state {}", jobId, job.state);
                return;
            }
            job.update(JobState.PROCESSING, 0, "Starting PDF text extraction...", clock.instant());
        });
    }

    public void advance(String jobId, int progress, String message) {
        transition(jobId, job -> {
            if (job.state != JobState.PROCESSING) {
                log.debug("Ignoring progress of job {} in state {}", jobId, job.state);
                return;
            }
            job.update(JobState.PROCESSING, Math.max(0, Math.min(100, progress)), message, clock.instant());
        });
    }

    public void complete(String jobId, ProcessingSummary summary) {
        transition(jobId, job -> {
            if (job.state.isTerminal()) {
                log.debug("Ignoring completion of finished job {}", jobId);
                return;
            }
            job.summary = summary;
            job.update(JobState.COMPLETED, 100, "PDF processing complete!", clock.instant());
            log.info("Job {} completed with {} articles", jobId, summary.totalArticles());
        });
    }

    public void fail(String jobId, String message) {
        transition(jobId, job -> {
            if (job.state.isTerminal()) {
                log.debug("Ignoring failure of finished job {}", jobId);
                return;
            }
            job.update(JobState.ERROR, 0, "Error: " + message, clock.instant());
            log.error("Job {} failed: {}", jobId, message);
        });
    }

    public Optional<JobStatus> find(String jobId) {
        ProcessingJob job = jobId == null ? null : jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.snapshot());
    }

    /**
     * @param jobId job identifier
     * @return current snapshot
     * @throws JobNotFoundException when the id is unknown or was evicted
     */
    public JobStatus require(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Removes finished jobs whose last update is older than the TTL.
     *
     * @return number of evicted jobs
     */
    @Scheduled(fixedDelayString = "${reportmerge.jobs.cleanup-interval:PT10M}")
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(settings.getTtl());
        int before = jobs.size();
        jobs.values().removeIf(job -> job.isExpired(cutoff));
        int evicted = before - jobs.size();
        if (evicted > 0) {
            log.info("Evicted {} finished jobs older than {}", evicted, settings.getTtl());
        }
        return evicted;
    }

    int size() {
        return jobs.size();
    }

    private void enforceCapacity() {
        int excess = jobs.size() - settings.getMaxEntries();
        if (excess <= 0) {
            return;
        }
        List<ProcessingJob> finished = jobs.values().stream()
                .filter(ProcessingJob::isFinished)
                .sorted(Comparator.comparing(ProcessingJob::updatedAt))
                .limit(excess)
                .toList();
        finished.forEach(job -> jobs.remove(job.jobId));
        if (!finished.isEmpty()) {
            log.info("Evicted {} finished jobs to stay within {} entries", finished.size(), settings.getMaxEntries());
        }
    }

    private void transition(String jobId, Consumer<ProcessingJob> change) {
        ProcessingJob job = jobs.get(jobId);
        if (job == null) {
            log.debug("Ignoring update of unknown job {}", jobId);
            return;
        }
        synchronized (job) {
            change.accept(job);
        }
    }

    private static final class ProcessingJob {
        private final String jobId;
        private final String folderPath;
        private final Instant createdAt;
        private JobState state = JobState.QUEUED;
        private int progress;
        private String message = "Queued";
        private Instant updatedAt;
        private ProcessingSummary summary;

        private ProcessingJob(String jobId, String folderPath, Instant createdAt) {
            this.jobId = jobId;
            this.folderPath = folderPath;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private void update(JobState state, int progress, String message, Instant at) {
            this.state = state;
            this.progress = progress;
            this.message = message;
            this.updatedAt = at;
        }

        private synchronized boolean isFinished() {
            return state.isTerminal();
        }

        private synchronized Instant updatedAt() {
            return updatedAt;
        }

        private synchronized boolean isExpired(Instant cutoff) {
            return state.isTerminal() && updatedAt.isBefore(cutoff);
        }

        private synchronized JobStatus snapshot() {
            return new JobStatus(jobId, folderPath, state, progress, message, createdAt, updatedAt, summary);
        }
    }
}
