package com.silverlakesymmetri.cbs.fileConverter.handler;

import com.silverlakesymmetri.cbs.fileConverter.batch.ConversionStepLauncher;
import com.silverlakesymmetri.cbs.fileConverter.batch.OutputFormatWriter;
import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemStreamReader;

import java.nio.file.Path;

/**
 * One output file as one chunk-oriented step: the cache reader feeds the optional processor and
 * the format writer, and {@link OutputFinalizationListener} completes the writer once every
 * record read has been written.
 */
public class ChunkedFormatHandler implements FormatHandler {
	private static final Logger logger = LoggerFactory.getLogger(ChunkedFormatHandler.class);

	private final String name;
	private final HandlerKind kind;
	private final ItemProcessor<DynamicRecord, DynamicRecord> processor;
	private final OutputFormatWriter writer;
	private final ConversionStepLauncher stepLauncher;
	private final int chunkSize;

	public ChunkedFormatHandler(String name, HandlerKind kind, ItemProcessor<DynamicRecord, DynamicRecord> processor,
								OutputFormatWriter writer, ConversionStepLauncher stepLauncher, int chunkSize) {
		if (chunkSize < 1) {
			throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
		}
		this.name = name;
		this.kind = kind;
		this.processor = processor;
		this.writer = writer;
		this.stepLauncher = stepLauncher;
		this.chunkSize = chunkSize;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public HandlerKind getKind() {
		return kind;
	}

	public Path getOutputPath() {
		return writer.getOutputPath();
	}

	@Override
	public Path toFile(ItemStreamReader<DynamicRecord> records) throws Exception {
		logger.info("[{}] Writing {}", name, writer.getOutputPath());
		OutputFinalizationListener finalization = new OutputFinalizationListener(name, writer);
		stepLauncher.run(name, chunkSize, records, processor, writer, finalization);
		return finalization.getOutputPath();
	}
}
