package com.silverlakesymmetri.cbs.fileConverter.handler;

import com.silverlakesymmetri.cbs.fileConverter.batch.OutputFormatWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.listener.StepExecutionListenerSupport;

import java.nio.file.Path;

/**
 * Step listener responsible for:
 * 1. Checking that every record read reached the writer
 * 2. Completing the writer, which moves its {@code .part} file to the final name
 * <p>
 * Runs before the step closes its streams, so a writer that is not completed here is discarded
 * on close.
 */
public class OutputFinalizationListener extends StepExecutionListenerSupport {

	private static final Logger logger = LoggerFactory.getLogger(OutputFinalizationListener.class);

	private final String name;
	private final OutputFormatWriter writer;
	private Path outputPath;

	public OutputFinalizationListener(String name, OutputFormatWriter writer) {
		this.name = name;
		this.writer = writer;
	}

	@Override
	public ExitStatus afterStep(StepExecution stepExecution) {
		boolean isSuccess = !stepExecution.getStatus().isUnsuccessful()
				&& stepExecution.getFailureExceptions().isEmpty();
		if (!isSuccess) {
			logger.warn("[{}] Step did not complete, discarding {}", name, writer.getOutputPath());
			return stepExecution.getExitStatus();
		}

		try {
			verifyCounts(stepExecution);
			outputPath = writer.complete();
			logger.info("[{}] Finished {} records -> {}", name, stepExecution.getWriteCount(), outputPath);
			return stepExecution.getExitStatus();
		} catch (Exception e) {
			logger.error("[{}] Finalization failed for {}", name, writer.getOutputPath(), e);
			stepExecution.addFailureException(e);
			return ExitStatus.FAILED;
		}
	}

	private void verifyCounts(StepExecution stepExecution) {
		long read = stepExecution.getReadCount();
		if (stepExecution.getFilterCount() > 0) {
			throw new IllegalStateException("[" + name + "] " + stepExecution.getFilterCount()
					+ " records were dropped by the processor");
		}
		if (stepExecution.getWriteCount() != read || writer.getRecordCount() != read) {
			throw new IllegalStateException("[" + name + "] wrote " + writer.getRecordCount()
					+ " records but read " + read);
		}
	}

	/**
	 * Final artifact path, or {@code null} until the step has completed.
	 */
	public Path getOutputPath() {
		return outputPath;
	}
}
