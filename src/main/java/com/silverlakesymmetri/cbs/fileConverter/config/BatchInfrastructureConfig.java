package com.silverlakesymmetri.cbs.fileConverter.config;

import com.silverlakesymmetri.cbs.fileConverter.batch.ConversionStepLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.JobBuilderFactory;
import org.springframework.batch.core.configuration.annotation.StepBuilderFactory;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;

/**
 * Job repository, launcher and builder factories for the conversion steps. The repository lives
 * in the embedded metadata database; launches are synchronous on the calling thread.
 */
@Configuration
@EnableBatchProcessing
public class BatchInfrastructureConfig {

	private static final Logger logger = LoggerFactory.getLogger(BatchInfrastructureConfig.class);

	@Value("${spring.batch.jdbc.table-prefix:BATCH_}")
	private String tablePrefix;

	@Value("${conversion.chunk-size:1000}")
	private int chunkSize;

	@PostConstruct
	public void logConfig() {
		logger.info("Batch infra initialized: tablePrefix={}, chunkSize={}", tablePrefix, chunkSize);
	}

	@Bean
	public ConversionStepLauncher conversionStepLauncher(JobBuilderFactory jobBuilderFactory,
														 StepBuilderFactory stepBuilderFactory,
														 JobLauncher jobLauncher) {
		return new ConversionStepLauncher(jobBuilderFactory, stepBuilderFactory, jobLauncher);
	}
}
