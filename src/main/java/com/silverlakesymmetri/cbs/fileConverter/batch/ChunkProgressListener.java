package com.silverlakesymmetri.cbs.fileConverter.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.listener.ChunkListenerSupport;
import org.springframework.batch.core.scope.context.ChunkContext;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.PROGRESS_LOG_INTERVAL;

/**
 * Logs the running write count each time a step passes another
 * {@code PROGRESS_LOG_INTERVAL} records.
 */
public class ChunkProgressListener extends ChunkListenerSupport {
	private static final Logger logger = LoggerFactory.getLogger(ChunkProgressListener.class);

	private final String stepName;
	private long lastReported;

	public ChunkProgressListener(String stepName) {
		this.stepName = stepName;
	}

	@Override
	public void afterChunk(ChunkContext context) {
		long written = context.getStepContext().getStepExecution().getWriteCount();
		long interval = written / PROGRESS_LOG_INTERVAL;
		if (interval > lastReported) {
			lastReported = interval;
			logger.info("[{}] {} records written", stepName, written);
		}
	}
}
