package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import com.silverlakesymmetri.cbs.fileConverter.spatial.ColumnNameMapper;
import com.silverlakesymmetri.cbs.fileConverter.spatial.Feature;
import com.silverlakesymmetri.cbs.fileConverter.spatial.FeatureSchema;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialDriver;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialFeatureWriter;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialWriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;

/**
 * Turns transformed records into features and hands them to a {@link SpatialFeatureWriter}
 * (GeoJSON or GeoPackage) writing into a {@code .part} file.
 */
public class SpatialFeatureOutputWriter implements OutputFormatWriter {
	private static final Logger logger = LoggerFactory.getLogger(SpatialFeatureOutputWriter.class);

	private final Path outputPath;
	private final Path partFilePath;
	private final SpatialWriterFactory writerFactory;
	private final SpatialDriver driver;
	private final FeatureSchema schema;
	private final int epsg;
	private final String layerName;
	private final Map<String, String> columnMap;
	private final FileFinalizationService fileFinalizationService;

	private SpatialFeatureWriter featureWriter;
	private long recordCount;
	private boolean completed;

	public SpatialFeatureOutputWriter(Path outputPath, SpatialWriterFactory writerFactory, SpatialDriver driver,
									  FeatureSchema schema, int epsg, String layerName,
									  FileFinalizationService fileFinalizationService) {
		this(outputPath, writerFactory, driver, schema, epsg, layerName, Collections.<String, String>emptyMap(),
				fileFinalizationService);
	}

	public SpatialFeatureOutputWriter(Path outputPath, SpatialWriterFactory writerFactory, SpatialDriver driver,
									  FeatureSchema schema, int epsg, String layerName, Map<String, String> columnMap,
									  FileFinalizationService fileFinalizationService) {
		this.outputPath = outputPath;
		this.partFilePath = FileFinalizationService.partPathFor(outputPath);
		this.writerFactory = writerFactory;
		this.driver = driver;
		this.schema = schema;
		this.epsg = epsg;
		this.layerName = layerName;
		this.columnMap = columnMap;
		this.fileFinalizationService = fileFinalizationService;
	}

	@Override
	public void open(ExecutionContext executionContext) throws ItemStreamException {
		try {
			Files.createDirectories(outputPath.toAbsolutePath().getParent());
			Files.deleteIfExists(partFilePath);
			featureWriter = writerFactory.open(partFilePath, driver, schema, epsg, layerName);
			recordCount = 0;
		} catch (IOException e) {
			throw new ItemStreamException("Failed to open " + driver + " writer for " + outputPath, e);
		}
	}

	@Override
	public void write(List<? extends DynamicRecord> items) throws Exception {
		for (DynamicRecord record : items) {
			featureWriter.write(toFeature(record, columnMap));
			recordCount++;
		}
	}

	/**
	 * Non-geometry fields become properties (renamed through {@code columnMap}); the geometry
	 * field must already be transformed.
	 */
	static Feature toFeature(DynamicRecord record, Map<String, String> columnMap) {
		Map<String, Object> properties = new LinkedHashMap<>();
		for (String column : record.getColumnNames()) {
			if (!GEOMETRY_FIELD.equals(column)) {
				properties.put(ColumnNameMapper.mapped(columnMap, column), record.getValue(column));
			}
		}
		Object geometry = record.getValue(GEOMETRY_FIELD);
		if (geometry != null && !(geometry instanceof GeoJsonGeometry)) {
			throw new SchemaException("Geometry was not transformed before writing: " + geometry);
		}
		return new Feature(properties, (GeoJsonGeometry) geometry);
	}

	@Override
	public void update(ExecutionContext executionContext) {
		// features are committed on complete()
	}

	@Override
	public Path complete() throws Exception {
		featureWriter.close();
		featureWriter = null;
		Path finalPath = fileFinalizationService.finalizeFile(partFilePath);
		completed = true;
		logger.info("Wrote {} features to {}", recordCount, finalPath);
		return finalPath;
	}

	@Override
	public void close() throws ItemStreamException {
		if (completed) {
			return;
		}
		if (featureWriter != null) {
			try {
				featureWriter.close();
			} catch (IOException | RuntimeException e) {
				logger.debug("Ignoring error while discarding {}: {}", partFilePath, e.getMessage());
			}
			featureWriter = null;
		}
		fileFinalizationService.cleanupPartFile(partFilePath);
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
