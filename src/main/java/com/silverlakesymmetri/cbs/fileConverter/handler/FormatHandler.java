package com.silverlakesymmetri.cbs.fileConverter.handler;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.springframework.batch.item.ItemStreamReader;

import java.nio.file.Path;

/**
 * Produces one output artifact from a stream of records.
 */
public interface FormatHandler {

	/**
	 * Result key, {@code "{format}-{epsg}"} or {@code "{format}-None"} for non-spatial outputs.
	 */
	String name();

	HandlerKind getKind();

	/**
	 * Consumes the unopened reader from start to end and returns the path of the finished
	 * artifact. The reader is opened and closed here.
	 */
	Path toFile(ItemStreamReader<DynamicRecord> records) throws Exception;
}
