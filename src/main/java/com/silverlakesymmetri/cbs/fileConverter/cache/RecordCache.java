package com.silverlakesymmetri.cbs.fileConverter.cache;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemStreamReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Handle on a fully written record cache. Only {@link RecordCacheWriter} creates one, after the
 * last record is on disk, so readers can never observe a partial cache.
 */
public final class RecordCache {
	private static final Logger logger = LoggerFactory.getLogger(RecordCache.class);

	private final Path path;
	private final long recordCount;
	private final String geometryType;

	RecordCache(Path path, long recordCount, String geometryType) {
		this.path = path;
		this.recordCount = recordCount;
		this.geometryType = geometryType;
	}

	/**
	 * A new reader positioned at the first record. Callers open and close it.
	 */
	public ItemStreamReader<DynamicRecord> openReader() {
		return new RecordCacheReader(path);
	}

	public Path getPath() {
		return path;
	}

	public long getRecordCount() {
		return recordCount;
	}

	/**
	 * Type of the first non-null geometry seen while caching, or {@code null}.
	 */
	public String getGeometryType() {
		return geometryType;
	}

	public void delete() {
		try {
			Files.deleteIfExists(path);
		} catch (IOException e) {
			logger.warn("Failed to delete record cache {}", path, e);
		}
	}
}
