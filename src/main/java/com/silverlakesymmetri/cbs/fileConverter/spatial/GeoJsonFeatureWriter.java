package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Streams a GeoJSON {@code FeatureCollection}. Features are written as they arrive so the
 * collection never has to fit in memory.
 */
public class GeoJsonFeatureWriter implements SpatialFeatureWriter {

	private final FeatureSchema schema;
	private final OutputStream out;
	private final JsonGenerator generator;
	private long featureCount;

	public GeoJsonFeatureWriter(Path path, FeatureSchema schema, int epsg, String layerName,
								ObjectMapper objectMapper) throws IOException {
		this.schema = schema;
		this.out = Files.newOutputStream(path);
		this.generator = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8);
		writeHeader(epsg, layerName);
	}

	private void writeHeader(int epsg, String layerName) throws IOException {
		generator.writeStartObject();
		generator.writeStringField("type", "FeatureCollection");
		generator.writeStringField("name", layerName);
		generator.writeObjectFieldStart("crs");
		generator.writeStringField("type", "name");
		generator.writeObjectFieldStart("properties");
		generator.writeStringField("name", crsUrn(epsg));
		generator.writeEndObject();
		generator.writeEndObject();
		generator.writeArrayFieldStart("features");
	}

	static String crsUrn(int epsg) {
		return epsg == 4326 ? "urn:ogc:def:crs:OGC:1.3:CRS84" : "urn:ogc:def:crs:EPSG::" + epsg;
	}

	@Override
	public void write(Feature feature) throws IOException {
		generator.writeStartObject();
		generator.writeStringField("type", "Feature");
		generator.writeObjectFieldStart("properties");
		for (Map.Entry<String, PropertyType> property : schema.getProperties().entrySet()) {
			generator.writeFieldName(property.getKey());
			generator.writeObject(property.getValue().coerce(feature.getProperties().get(property.getKey())));
		}
		generator.writeEndObject();
		generator.writeFieldName("geometry");
		if (feature.getGeometry() == null) {
			generator.writeNull();
		} else {
			generator.writeObject(feature.getGeometry().toMap());
		}
		generator.writeEndObject();
		featureCount++;
	}

	@Override
	public long getFeatureCount() {
		return featureCount;
	}

	@Override
	public void close() throws IOException {
		try {
			generator.writeEndArray();
			generator.writeEndObject();
			generator.writeRaw('\n');
			generator.flush();
		} finally {
			generator.close();
			out.close();
		}
	}
}
