package com.example.reportmerge;

import com.example.reportmerge.application.service.DocumentMatcher;
import com.example.reportmerge.application.service.ProcessingJobService;
import com.example.reportmerge.config.ReportMergeProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class ReportMergeApplicationTests {

	@Autowired
	private ProcessingJobService processingJobService;

	@Autowired
	private DocumentMatcher documentMatcher;

	@Autowired
	private ReportMergeProperties properties;

	/**
	 * Ensures the application context loads and binds the default configuration.
	 */
	@Test
	void contextLoads() {
		assertThat(processingJobService).isNotNull();
		assertThat(documentMatcher).isNotNull();
		assertThat(properties.getSourceSuffix()).isEqualTo("_reports.json");
		assertThat(properties.getJobs().getTtl()).isEqualTo(Duration.ofHours(6));
	}

}
