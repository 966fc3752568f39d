package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Base for writers that stream text into a {@code .part} file: opens the stream, counts records,
 * flushes on {@link #update(ExecutionContext)} and finalizes or discards the file.
 */
public abstract class AbstractBaseOutputWriter implements OutputFormatWriter {
	protected final Logger logger = LoggerFactory.getLogger(getClass());

	private static final int BUFFER_SIZE = 64 * 1024;

	protected final Path outputPath;
	protected final Path partFilePath;
	protected final FileFinalizationService fileFinalizationService;

	protected OutputStream outputStream;
	protected long recordCount = 0;
	private boolean completed = false;

	protected AbstractBaseOutputWriter(Path outputPath, FileFinalizationService fileFinalizationService) {
		this.outputPath = outputPath;
		this.partFilePath = FileFinalizationService.partPathFor(outputPath);
		this.fileFinalizationService = fileFinalizationService;
	}

	@Override
	public void open(ExecutionContext executionContext) throws ItemStreamException {
		try {
			ensureDirectoryExists(outputPath);
			outputStream = new BufferedOutputStream(Files.newOutputStream(partFilePath,
					StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE), BUFFER_SIZE);
			recordCount = 0;
			openStream(outputStream);
			writeHeader();
			logger.debug("Opened {} for {}", partFilePath, outputPath.getFileName());
		} catch (Exception e) {
			closeQuietly();
			throw new ItemStreamException("Failed to open " + partFilePath, e);
		}
	}

	@Override
	public void write(List<? extends DynamicRecord> items) throws Exception {
		for (DynamicRecord record : items) {
			writeRecord(record);
			recordCount++;
		}
	}

	@Override
	public void update(ExecutionContext executionContext) {
		try {
			flushInternal();
			if (outputStream != null) outputStream.flush();
		} catch (Exception e) {
			throw new ItemStreamException("Failed to flush " + partFilePath, e);
		}
	}

	@Override
	public Path complete() throws Exception {
		writeFooter();
		flushInternal();
		closeStream();
		outputStream.close();
		outputStream = null;
		Path finalPath = fileFinalizationService.finalizeFile(partFilePath);
		completed = true;
		logger.info("Wrote {} records to {}", recordCount, finalPath);
		return finalPath;
	}

	@Override
	public void close() throws ItemStreamException {
		if (completed) {
			return;
		}
		closeQuietly();
		fileFinalizationService.cleanupPartFile(partFilePath);
	}

	// Format-specific hooks
	protected abstract void openStream(OutputStream os) throws Exception;

	protected abstract void writeRecord(DynamicRecord record) throws Exception;

	protected abstract void flushInternal() throws Exception;

	protected abstract void writeHeader() throws Exception;

	protected abstract void writeFooter() throws Exception;

	/**
	 * Releases the format's own writer; the underlying stream is closed afterwards by the base.
	 */
	protected void closeStream() throws Exception {
	}

	private static void ensureDirectoryExists(Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) Files.createDirectories(parent);
	}

	protected void closeQuietly() {
		try {
			closeStream();
		} catch (Exception e) {
			logger.debug("Ignoring error while discarding {}: {}", partFilePath, e.getMessage());
		}
		try {
			if (outputStream != null) outputStream.close();
		} catch (IOException e) {
			logger.debug("Ignoring error while closing {}: {}", partFilePath, e.getMessage());
		}
		outputStream = null;
	}

	@Override
	public long getRecordCount() {
		return recordCount;
	}

	@Override
	public Path getOutputPath() {
		return outputPath;
	}
}
