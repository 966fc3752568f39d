package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.springframework.batch.item.ItemStreamWriter;

import java.nio.file.Path;

/**
 * Writer for one output artifact. Content goes to a {@code .part} file which only becomes the
 * output file through {@link #complete()}; closing a writer that was never completed discards
 * the part file.
 */
public interface OutputFormatWriter extends ItemStreamWriter<DynamicRecord> {

	/**
	 * Writes any trailer, closes the file and moves it to its final name.
	 *
	 * @return path of the finished artifact
	 */
	Path complete() throws Exception;

	/**
	 * Records accepted by {@link #write(java.util.List)} so far.
	 */
	long getRecordCount();

	/**
	 * Final artifact location.
	 */
	Path getOutputPath();
}
