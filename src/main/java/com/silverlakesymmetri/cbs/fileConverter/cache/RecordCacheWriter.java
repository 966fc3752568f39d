package com.silverlakesymmetri.cbs.fileConverter.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.batch.ConversionStepLauncher;
import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeometryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;

/**
 * Drains a record source into a JSON-lines file, one self-contained object per line, so the
 * source is queried once no matter how many outputs are produced.
 */
@Component
public class RecordCacheWriter {
	private static final Logger logger = LoggerFactory.getLogger(RecordCacheWriter.class);

	static final String STEP_NAME = "recordCache";

	private final ObjectMapper objectMapper;
	private final GeometryParser geometryParser;
	private final ConversionStepLauncher stepLauncher;
	private final int chunkSize;

	@Autowired
	public RecordCacheWriter(ObjectMapper objectMapper, GeometryParser geometryParser,
							 ConversionStepLauncher stepLauncher, ConversionProperties properties) {
		this(objectMapper, geometryParser, stepLauncher, properties.getChunkSize());
	}

	public RecordCacheWriter(ObjectMapper objectMapper, GeometryParser geometryParser,
							 ConversionStepLauncher stepLauncher, int chunkSize) {
		this.objectMapper = objectMapper;
		this.geometryParser = geometryParser;
		this.stepLauncher = stepLauncher;
		this.chunkSize = chunkSize;
	}

	public RecordCache materialize(ItemReader<DynamicRecord> source, Path cacheFile) throws Exception {
		FlatFileItemWriter<DynamicRecord> writer = new FlatFileItemWriter<>();
		writer.setName("recordCacheWriter");
		writer.setResource(new FileSystemResource(cacheFile));
		writer.setEncoding(StandardCharsets.UTF_8.name());
		writer.setSaveState(false);
		writer.setShouldDeleteIfExists(true);
		writer.setLineAggregator(this::toJsonLine);
		writer.afterPropertiesSet();

		GeometryTypeSampler sampler = new GeometryTypeSampler();
		StepExecution execution = stepLauncher.run(STEP_NAME, chunkSize, source, sampler, writer, null);

		long count = execution.getWriteCount();
		logger.info("Record cache complete: {} records, geometry type={}", count, sampler.geometryType);
		return new RecordCache(cacheFile, count, sampler.geometryType);
	}

	private String toJsonLine(DynamicRecord record) {
		try {
			return objectMapper.writeValueAsString(record.asValueMap());
		} catch (JsonProcessingException e) {
			throw new SchemaException("Record cannot be cached as JSON: " + record, e);
		}
	}

	/**
	 * Passes records through unchanged, remembering the type of the first readable geometry.
	 */
	private class GeometryTypeSampler implements ItemProcessor<DynamicRecord, DynamicRecord> {
		private String geometryType;

		@Override
		public DynamicRecord process(DynamicRecord record) {
			if (geometryType == null && record.hasColumn(GEOMETRY_FIELD)) {
				geometryType = sample(record.getValue(GEOMETRY_FIELD));
			}
			return record;
		}

		private String sample(Object geometry) {
			try {
				return geometryParser.peekType(geometry);
			} catch (SchemaException e) {
				// spatial handlers reject the record later; non-spatial outputs carry it as text
				logger.warn("Skipping unreadable geometry while sampling type: {}", e.getMessage());
				return null;
			}
		}
	}
}
