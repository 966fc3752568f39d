package com.silverlakesymmetri.cbs.fileConverter.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.batch.ConversionStepLauncher;
import com.silverlakesymmetri.cbs.fileConverter.batch.GenericCSVWriter;
import com.silverlakesymmetri.cbs.fileConverter.batch.GenericJSONWriter;
import com.silverlakesymmetri.cbs.fileConverter.batch.GenericXMLWriter;
import com.silverlakesymmetri.cbs.fileConverter.batch.GeometryTransformProcessor;
import com.silverlakesymmetri.cbs.fileConverter.batch.OutputFormatWriter;
import com.silverlakesymmetri.cbs.fileConverter.batch.RecordValueFormatter;
import com.silverlakesymmetri.cbs.fileConverter.batch.SpatialFeatureOutputWriter;
import com.silverlakesymmetri.cbs.fileConverter.batch.ZippedShapefileWriter;
import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import com.silverlakesymmetri.cbs.fileConverter.config.FormatConfigLoader;
import com.silverlakesymmetri.cbs.fileConverter.config.model.FormatConfig;
import com.silverlakesymmetri.cbs.fileConverter.dto.DatasetMetadata;
import com.silverlakesymmetri.cbs.fileConverter.dto.FieldDefinition;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.exception.ValidationException;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeometryParser;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeometryReprojector;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeometryTransformer;
import com.silverlakesymmetri.cbs.fileConverter.geometry.MultiGeometryTypes;
import com.silverlakesymmetri.cbs.fileConverter.handler.params.ConversionParams;
import com.silverlakesymmetri.cbs.fileConverter.handler.params.SpatialConversionParams;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import com.silverlakesymmetri.cbs.fileConverter.spatial.ColumnNameMapper;
import com.silverlakesymmetri.cbs.fileConverter.spatial.FeatureSchema;
import com.silverlakesymmetri.cbs.fileConverter.spatial.PropertyType;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialWriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.NON_SPATIAL_EPSG_KEY;

/**
 * Builds one {@link FormatHandler} per requested output. Spatial requests get one handler per
 * (target EPSG, format) pair, named {@code "{name} - {epsg}.{format}"}; non-spatial requests get
 * one per format, named {@code "{name}.{format}"}.
 */
@Component
public class HandlerFactory {
	private static final Logger logger = LoggerFactory.getLogger(HandlerFactory.class);

	private final FormatConfigLoader formatConfigLoader;
	private final GeometryParser geometryParser;
	private final GeometryReprojector reprojector;
	private final SpatialWriterFactory spatialWriterFactory;
	private final RecordValueFormatter valueFormatter;
	private final ObjectMapper objectMapper;
	private final FileFinalizationService fileFinalizationService;
	private final ConversionStepLauncher stepLauncher;
	private final ConversionProperties properties;

	public HandlerFactory(FormatConfigLoader formatConfigLoader, GeometryParser geometryParser,
						  GeometryReprojector reprojector, SpatialWriterFactory spatialWriterFactory,
						  RecordValueFormatter valueFormatter, ObjectMapper objectMapper,
						  FileFinalizationService fileFinalizationService, ConversionStepLauncher stepLauncher,
						  ConversionProperties properties) {
		this.formatConfigLoader = formatConfigLoader;
		this.geometryParser = geometryParser;
		this.reprojector = reprojector;
		this.spatialWriterFactory = spatialWriterFactory;
		this.valueFormatter = valueFormatter;
		this.objectMapper = objectMapper;
		this.fileFinalizationService = fileFinalizationService;
		this.stepLauncher = stepLauncher;
		this.properties = properties;
	}

	public List<FormatHandler> createHandlers(ConversionParams params, Path outputDir, DatasetMetadata metadata) {
		List<FormatHandler> handlers = new ArrayList<>();
		if (params.isSpatial()) {
			SpatialConversionParams spatial = (SpatialConversionParams) params;
			for (Integer targetEpsg : spatial.getTargetEpsgs()) {
				for (String format : spatial.getTargetFormats()) {
					handlers.add(createSpatialHandler(format, spatial.getSourceEpsg(), targetEpsg, outputDir, metadata));
				}
			}
		} else {
			for (String format : params.getTargetFormats()) {
				handlers.add(createNonSpatialHandler(format, outputDir, metadata));
			}
		}
		logger.info("Created {} handlers for {}", handlers.size(), metadata.getName());
		return handlers;
	}

	/* ================= Kind resolution ================= */

	static HandlerKind kindOf(String format, boolean spatial) {
		if (spatial) {
			switch (format) {
				case "csv":
					return HandlerKind.SPATIAL_CSV;
				case "geojson":
				case "gpkg":
					return HandlerKind.SPATIAL_GENERIC;
				case "shp":
					return HandlerKind.SPATIAL_SHAPEFILE;
				default:
					throw new ValidationException("Unsupported spatial format: " + format);
			}
		}
		switch (format) {
			case "csv":
				return HandlerKind.NON_SPATIAL_CSV;
			case "json":
				return HandlerKind.NON_SPATIAL_JSON;
			case "xml":
				return HandlerKind.NON_SPATIAL_XML;
			default:
				throw new ValidationException("Unsupported non-spatial format: " + format);
		}
	}

	/* ================= Non-spatial ================= */

	private FormatHandler createNonSpatialHandler(String format, Path outputDir, DatasetMetadata metadata) {
		HandlerKind kind = kindOf(format, false);
		Path outputPath = outputDir.resolve(metadata.getName() + "." + format);
		String key = format + "-" + NON_SPATIAL_EPSG_KEY;

		OutputFormatWriter writer;
		switch (kind) {
			case NON_SPATIAL_CSV:
				writer = new GenericCSVWriter(outputPath, metadata.getFieldIds(), valueFormatter, fileFinalizationService);
				break;
			case NON_SPATIAL_JSON:
				writer = new GenericJSONWriter(outputPath, objectMapper, fileFinalizationService);
				break;
			case NON_SPATIAL_XML:
				writer = new GenericXMLWriter(outputPath, valueFormatter, properties.getXmlChunkSize(),
						fileFinalizationService);
				break;
			default:
				throw new IllegalStateException("Not a non-spatial handler kind: " + kind);
		}
		return new ChunkedFormatHandler(key, kind, null, writer, stepLauncher, properties.getChunkSize());
	}

	/* ================= Spatial ================= */

	private FormatHandler createSpatialHandler(String format, int sourceEpsg, int targetEpsg, Path outputDir,
											   DatasetMetadata metadata) {
		HandlerKind kind = kindOf(format, true);
		String baseName = metadata.getName() + " - " + targetEpsg;
		Path outputPath = outputDir.resolve(baseName + "." + format);
		String key = format + "-" + targetEpsg;

		GeometryTransformProcessor processor = new GeometryTransformProcessor(
				new GeometryTransformer(geometryParser, reprojector, sourceEpsg, targetEpsg));

		OutputFormatWriter writer;
		switch (kind) {
			case SPATIAL_CSV:
				writer = new GenericCSVWriter(outputPath, metadata.getFieldIds(), valueFormatter, fileFinalizationService);
				break;
			case SPATIAL_GENERIC:
				writer = new SpatialFeatureOutputWriter(outputPath, spatialWriterFactory, formatConfig().driverFor(format),
						featureSchema(metadata, null), targetEpsg, baseName, fileFinalizationService);
				break;
			case SPATIAL_SHAPEFILE: {
				Map<String, String> columnMap = ColumnNameMapper.mapColumns(metadata.getFieldIds());
				writer = new ZippedShapefileWriter(outputPath, metadata.getName(), metadata.getFieldIds(),
						featureSchema(metadata, columnMap), columnMap, targetEpsg, spatialWriterFactory,
						fileFinalizationService);
				break;
			}
			default:
				throw new IllegalStateException("Not a spatial handler kind: " + kind);
		}
		return new ChunkedFormatHandler(key, kind, processor, writer, stepLauncher, properties.getChunkSize());
	}

	/**
	 * Layer schema: the sampled geometry type promoted to its Multi form, and one property per
	 * non-geometry field, renamed through {@code columnMap} when given.
	 */
	FeatureSchema featureSchema(DatasetMetadata metadata, Map<String, String> columnMap) {
		if (metadata.getGeometryType() == null) {
			throw new SchemaException("Dataset " + metadata.getName() + " has no geometry type to build a layer from");
		}
		String geometryType = MultiGeometryTypes.toMulti(metadata.getGeometryType());

		FormatConfig config = formatConfig();
		Map<String, PropertyType> properties = new LinkedHashMap<>();
		for (FieldDefinition field : metadata.getFields()) {
			if (GEOMETRY_FIELD.equals(field.getId())) {
				continue;
			}
			String name = columnMap == null ? field.getId() : ColumnNameMapper.mapped(columnMap, field.getId());
			properties.put(name, config.propertyTypeFor(field.getBaseType()));
		}
		return new FeatureSchema(geometryType, properties);
	}

	private FormatConfig formatConfig() {
		return formatConfigLoader.getFormatConfig();
	}
}
