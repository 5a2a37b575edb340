package com.example.reportmerge.application.service;

import com.example.reportmerge.config.ReportMergeProperties;
import com.example.reportmerge.domain.exception.JobNotFoundException;
import com.example.reportmerge.domain.model.JobState;
import com.example.reportmerge.domain.model.JobStatus;
import com.example.reportmerge.domain.model.MatchingStatistics;
import com.example.reportmerge.domain.model.ProcessingSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessingJobRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:15:30Z"));
    private final ReportMergeProperties properties = new ReportMergeProperties();
    private ProcessingJobRegistry registry;

    @BeforeEach
    void setUp() {
        properties.getJobs().setTtl(Duration.ofHours(1));
        properties.getJobs().setMaxEntries(3);
        registry = new ProcessingJobRegistry(clock, properties);
    }

    @Test
    void createsQueuedJobWithTimestampedId() {
        JobStatus job = registry.create("/data/haiti");

        assertThat(job.jobId()).isEqualTo("process_20240301_101530_1");
        assertThat(job.status()).isEqualTo(JobState.QUEUED);
        assertThat(job.folderPath()).isEqualTo("/data/haiti");
        assertThat(registry.create("/data/haiti").jobId()).isEqualTo("process_20240301_101530_2");
    }

    @Test
    void walksThroughProcessingToCompletion() {
        String id = registry.create("/data/haiti").jobId();

        registry.start(id);
        registry.advance(id, 45, "Processing PDF 3/7");
        assertThat(registry.require(id).progress()).isEqualTo(45);
        assertThat(registry.require(id).status()).isEqualTo(JobState.PROCESSING);

        registry.advance(id, 140, "overshoot");
        assertThat(registry.require(id).progress()).isEqualTo(100);

        ProcessingSummary summary = new ProcessingSummary("/out.json", 2, 1, 1, 1, new MatchingStatistics());
        registry.complete(id, summary);

        JobStatus done = registry.require(id);
        assertThat(done.status()).isEqualTo(JobState.COMPLETED);
        assertThat(done.progress()).isEqualTo(100);
        assertThat(done.summary()).isEqualTo(summary);
    }

    @Test
    void finishedJobsIgnoreFurtherTransitions() {
        String id = registry.create("/data").jobId();
        registry.start(id);
        registry.fail(id, "boom");

        registry.advance(id, 50, "late progress");
        registry.complete(id, new ProcessingSummary("/out.json", 0, 0, 0, 0, new MatchingStatistics()));

        JobStatus status = registry.require(id);
        assertThat(status.status()).isEqualTo(JobState.ERROR);
        assertThat(status.message()).isEqualTo("Error: boom");
        assertThat(status.summary()).isNull();
    }

    @Test
    void progressIsIgnoredBeforeStart() {
        String id = registry.create("/data").jobId();

        registry.advance(id, 30, "too early");

        assertThat(registry.require(id).progress()).isZero();
        assertThat(registry.require(id).status()).isEqualTo(JobState.QUEUED);
    }

    @Test
    void unknownJobsAreReported() {
        assertThat(registry.find("process_unknown")).isEmpty();
        assertThatThrownBy(() -> registry.require("process_unknown"))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessageContaining("process_unknown");
    }

    @Test
    void evictsOnlyFinishedJobsPastTheirTtl() {
        String finished = registry.create("/a").jobId();
        registry.start(finished);
        registry.fail(finished, "x");
        String running = registry.create("/b").jobId();
        registry.start(running);

        clock.advance(Duration.ofMinutes(30));
        assertThat(registry.evictExpired()).isZero();

        clock.advance(Duration.ofMinutes(31));
        assertThat(registry.evictExpired()).isEqualTo(1);
        assertThat(registry.find(finished)).isEmpty();
        assertThat(registry.find(running)).isPresent();
    }

    @Test
    void capacityEvictsOldestFinishedJobsFirst() {
        String oldest = finishedJob("/1");
        clock.advance(Duration.ofSeconds(1));
        String newer = finishedJob("/2");
        clock.advance(Duration.ofSeconds(1));
        String active = registry.create("/3").jobId();

        registry.create("/4");

        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.find(oldest)).isEmpty();
        assertThat(registry.find(newer)).isPresent();
        assertThat(registry.find(active)).isPresent();
    }

    private String finishedJob(String folder) {
        String id = registry.create(folder).jobId();
        registry.start(id);
        registry.complete(id, new ProcessingSummary("/out.json", 0, 0, 0, 0, new MatchingStatistics()));
        return id;
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
