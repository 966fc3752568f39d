package com.silverlakesymmetri.cbs.fileConverter.cache;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.mapping.JsonLineMapper;
import org.springframework.core.io.FileSystemResource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a JSON-lines cache file back as {@link DynamicRecord}s, always from the first line.
 */
public class RecordCacheReader implements ItemStreamReader<DynamicRecord> {

	private final FlatFileItemReader<DynamicRecord> delegate;

	RecordCacheReader(Path cacheFile) {
		JsonLineMapper jsonLineMapper = new JsonLineMapper();
		FlatFileItemReader<DynamicRecord> reader = new FlatFileItemReader<>();
		reader.setName("recordCacheReader");
		reader.setResource(new FileSystemResource(cacheFile));
		reader.setEncoding(StandardCharsets.UTF_8.name());
		reader.setSaveState(false);
		reader.setStrict(true);
		reader.setLineMapper((line, lineNumber) -> {
			Map<String, Object> values = jsonLineMapper.mapLine(line, lineNumber);
			return DynamicRecord.fromMap(values);
		});
		this.delegate = reader;
	}

	@Override
	public void open(ExecutionContext executionContext) throws ItemStreamException {
		delegate.open(executionContext);
	}

	@Override
	public DynamicRecord read() throws Exception {
		return delegate.read();
	}

	@Override
	public void update(ExecutionContext executionContext) throws ItemStreamException {
		delegate.update(executionContext);
	}

	@Override
	public void close() throws ItemStreamException {
		delegate.close();
	}
}
