package com.example.reportmerge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed view of the {@code reportmerge.*} properties.
 */
@ConfigurationProperties(prefix = "reportmerge")
public class ReportMergeProperties {

    private String dataDir = "./reliefweb_data";
    private String pdfSubdirectory = "pdfs";
    private String sourceSuffix = "_reports.json";
    private String outputSuffix = "_reports_full_text.json";
    private final Jobs jobs = new Jobs();
    private final Executor executor = new Executor();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getPdfSubdirectory() {
        return pdfSubdirectory;
    }

    public void setPdfSubdirectory(String pdfSubdirectory) {
        this.pdfSubdirectory = pdfSubdirectory;
    }

    public String getSourceSuffix() {
        return sourceSuffix;
    }

    public void setSourceSuffix(String sourceSuffix) {
        this.sourceSuffix = sourceSuffix;
    }

    public String getOutputSuffix() {
        return outputSuffix;
    }

    public void setOutputSuffix(String outputSuffix) {
        this.outputSuffix = outputSuffix;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * Retention of finished processing jobs.
     */
    public static class Jobs {
        private Duration ttl = Duration.ofHours(6);
        private int maxEntries = 100;
        private Duration cleanupInterval = Duration.ofMinutes(10);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }

    /**
     * Sizing of the pool that runs merge jobs.
     */
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
