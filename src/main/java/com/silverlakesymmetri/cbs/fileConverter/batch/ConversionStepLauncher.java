package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.core.configuration.annotation.JobBuilderFactory;
import org.springframework.batch.core.configuration.annotation.StepBuilderFactory;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.step.builder.SimpleStepBuilder;
import org.springframework.batch.core.step.tasklet.TaskletStep;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.ItemWriter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_OUTPUT;

/**
 * Runs one chunk-oriented step (read, optionally process, write) as a single-step job. Filling
 * the record cache and producing every output file both go through here. Readers, processors and
 * writers that are {@link org.springframework.batch.item.ItemStream}s are opened and closed by
 * the step.
 * <p>
 * A step that does not complete is rethrown as its first failure exception, so callers see the
 * reader's, processor's or writer's own error. While the step runs the step name is the
 * {@code output} MDC key of the launching thread.
 */
public class ConversionStepLauncher {
	private static final Logger logger = LoggerFactory.getLogger(ConversionStepLauncher.class);

	public static final String RUN_ID_PARAM = "runId";

	private final JobBuilderFactory jobBuilderFactory;
	private final StepBuilderFactory stepBuilderFactory;
	private final JobLauncher jobLauncher;

	public ConversionStepLauncher(JobBuilderFactory jobBuilderFactory, StepBuilderFactory stepBuilderFactory,
								  JobLauncher jobLauncher) {
		this.jobBuilderFactory = jobBuilderFactory;
		this.stepBuilderFactory = stepBuilderFactory;
		this.jobLauncher = jobLauncher;
	}

	/**
	 * @param processor may be {@code null}; records then pass to the writer unchanged
	 * @param listener  may be {@code null}
	 * @return the completed step execution, carrying read, filter and write counts
	 */
	public StepExecution run(String name, int chunkSize, ItemReader<? extends DynamicRecord> reader,
							 ItemProcessor<DynamicRecord, DynamicRecord> processor,
							 ItemWriter<? super DynamicRecord> writer,
							 StepExecutionListener listener) throws Exception {
		if (chunkSize < 1) {
			throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
		}

		SimpleStepBuilder<DynamicRecord, DynamicRecord> builder = stepBuilderFactory.get(name)
				.<DynamicRecord, DynamicRecord>chunk(chunkSize);
		builder.reader(reader);
		if (processor != null) {
			builder.processor(processor);
		}
		builder.writer(writer);
		builder.listener(new ChunkProgressListener(name));
		if (listener != null) {
			builder.listener(listener);
		}
		TaskletStep step = builder.build();

		Job job = jobBuilderFactory.get(name).start(step).build();
		JobParameters parameters = new JobParametersBuilder()
				.addString(RUN_ID_PARAM, UUID.randomUUID().toString())
				.toJobParameters();

		MDC.put(MDC_OUTPUT, name);
		try {
			logger.debug("[{}] Launching step with chunk size {}", name, chunkSize);
			JobExecution execution = jobLauncher.run(job, parameters);

			StepExecution stepExecution = firstStepExecution(execution);
			if (!isSuccessful(execution, stepExecution)) {
				throw failureOf(name, execution, stepExecution);
			}
			logger.debug("[{}] Step complete: read={}, written={}", name, stepExecution.getReadCount(),
					stepExecution.getWriteCount());
			return stepExecution;
		} finally {
			MDC.remove(MDC_OUTPUT);
		}
	}

	private static StepExecution firstStepExecution(JobExecution execution) {
		Iterator<StepExecution> steps = execution.getStepExecutions().iterator();
		return steps.hasNext() ? steps.next() : null;
	}

	private static boolean isSuccessful(JobExecution execution, StepExecution stepExecution) {
		return stepExecution != null
				&& stepExecution.getStatus() == BatchStatus.COMPLETED
				&& ExitStatus.COMPLETED.getExitCode().equals(stepExecution.getExitStatus().getExitCode())
				&& execution.getAllFailureExceptions().isEmpty();
	}

	private static Exception failureOf(String name, JobExecution execution, StepExecution stepExecution) {
		List<Throwable> failures = new ArrayList<>();
		if (stepExecution != null) {
			failures.addAll(stepExecution.getFailureExceptions());
		}
		for (Throwable failure : execution.getAllFailureExceptions()) {
			if (!failures.contains(failure)) {
				failures.add(failure);
			}
		}
		if (failures.isEmpty()) {
			return new IllegalStateException("[" + name + "] step ended with status " + execution.getStatus());
		}
		Throwable first = failures.get(0);
		for (int i = 1; i < failures.size(); i++) {
			first.addSuppressed(failures.get(i));
		}
		if (first instanceof Error) {
			throw (Error) first;
		}
		return (Exception) first;
	}
}
