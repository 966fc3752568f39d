package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoJsonFeatureWriterTest {

	@TempDir
	Path tempDir;

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void crsNameFollowsEpsg() {
		assertEquals("urn:ogc:def:crs:OGC:1.3:CRS84", GeoJsonFeatureWriter.crsUrn(4326));
		assertEquals("urn:ogc:def:crs:EPSG::2952", GeoJsonFeatureWriter.crsUrn(2952));
	}

	@Test
	void writesFeatureCollectionWithTypedProperties() throws Exception {
		Map<String, PropertyType> properties = new LinkedHashMap<>();
		properties.put("_id", PropertyType.INT);
		properties.put("ward", PropertyType.STRING);
		properties.put("area", PropertyType.FLOAT);
		FeatureSchema schema = new FeatureSchema("MultiPoint", properties);
		Path output = tempDir.resolve("wards - 2952.geojson");

		GeoJsonFeatureWriter writer = new GeoJsonFeatureWriter(output, schema, 2952, "wards - 2952", objectMapper);
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("_id", "7");
		values.put("ward", "York");
		values.put("area", "");
		writer.write(new Feature(values, GeoJsonGeometry.of("MultiPoint",
				Collections.<Object>singletonList(Arrays.asList(304800.0, 4828000.0)))));
		writer.write(new Feature(Collections.<String, Object>singletonMap("_id", 8), null));
		writer.close();

		JsonNode root = objectMapper.readTree(output.toFile());
		assertEquals("FeatureCollection", root.get("type").asText());
		assertEquals("wards - 2952", root.get("name").asText());
		assertEquals("urn:ogc:def:crs:EPSG::2952", root.path("crs").path("properties").path("name").asText());
		assertEquals(2, root.get("features").size());

		JsonNode first = root.get("features").get(0);
		assertEquals(7, first.path("properties").path("_id").asInt());
		assertTrue(first.path("properties").path("_id").isIntegralNumber());
		assertTrue(first.path("properties").path("area").isNull());
		assertEquals("MultiPoint", first.path("geometry").path("type").asText());
		assertEquals(304800.0, first.path("geometry").path("coordinates").get(0).get(0).asDouble(), 0.0);

		JsonNode second = root.get("features").get(1);
		assertTrue(second.get("geometry").isNull());
		assertTrue(second.path("properties").path("ward").isNull());
		assertEquals(2, writer.getFeatureCount());
	}
}
