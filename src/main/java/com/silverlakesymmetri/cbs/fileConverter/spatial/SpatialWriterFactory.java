package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.config.model.FormatConfig;
import com.silverlakesymmetri.cbs.fileConverter.config.model.ProjectionDefinition;
import com.silverlakesymmetri.cbs.fileConverter.spatial.shapefile.ShapefileFeatureWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a {@link SpatialFeatureWriter} for a driver, a layer schema and a target CRS.
 */
public class SpatialWriterFactory {
	private static final Logger logger = LoggerFactory.getLogger(SpatialWriterFactory.class);

	private final FormatConfig formatConfig;
	private final ObjectMapper objectMapper;

	public SpatialWriterFactory(FormatConfig formatConfig, ObjectMapper objectMapper) {
		this.formatConfig = formatConfig;
		this.objectMapper = objectMapper;
	}

	public SpatialFeatureWriter open(Path path, SpatialDriver driver, FeatureSchema schema,
									 int epsg, String layerName) throws IOException {
		ProjectionDefinition projection = formatConfig.projectionFor(epsg);
		logger.debug("Opening {} writer at {} (EPSG:{}, geometry={})", driver, path, epsg, schema.getGeometryType());
		switch (driver) {
			case GEOJSON:
				return new GeoJsonFeatureWriter(path, schema, epsg, layerName, objectMapper);
			case GPKG:
				return new GeoPackageFeatureWriter(path, schema, epsg, layerName, projection);
			case ESRI_SHAPEFILE:
				return new ShapefileFeatureWriter(path, schema, projection.getEsriWkt());
			default:
				throw new IllegalArgumentException("Unsupported spatial driver: " + driver);
		}
	}
}
