package com.example.reportmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the report merge service.
 * Wires the application context and hands control to Spring.
 */
@SpringBootApplication
public class ReportMergeApplication {

	/**
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ReportMergeApplication.class, args);
	}

}
