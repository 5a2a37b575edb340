package com.example.reportmerge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pool for background merge jobs and the scheduler used for job eviction.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(ReportMergeProperties.class)
public class ExecutorConfig {

    /**
     * Pool that runs folder processing jobs. Submissions beyond the queue capacity are rejected.
     *
     * @param properties executor sizing
     * @return initialized executor
     */
    @Bean(name = "reportMergeExecutor")
    public ThreadPoolTaskExecutor reportMergeExecutor(ReportMergeProperties properties) {
        ReportMergeProperties.Executor sizing = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sizing.getCorePoolSize());
        executor.setMaxPoolSize(sizing.getMaxPoolSize());
        executor.setQueueCapacity(sizing.getQueueCapacity());
        executor.setThreadNamePrefix("report-merge-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
