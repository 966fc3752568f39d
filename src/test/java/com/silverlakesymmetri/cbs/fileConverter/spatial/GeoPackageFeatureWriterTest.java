package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.TestFixtures;
import com.silverlakesymmetri.cbs.fileConverter.config.model.ProjectionDefinition;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class GeoPackageFeatureWriterTest {

	@TempDir
	Path tempDir;

	@Test
	void writesRegisteredFeatureTable() throws Exception {
		ProjectionDefinition projection = TestFixtures.formatConfigLoader(new ObjectMapper())
				.getFormatConfig().projectionFor(2952);
		Map<String, PropertyType> properties = new LinkedHashMap<>();
		properties.put("_id", PropertyType.INT);
		properties.put("name", PropertyType.STRING);
		FeatureSchema schema = new FeatureSchema("MultiPoint", properties);
		Path output = tempDir.resolve("parks - 2952.gpkg");

		GeoPackageFeatureWriter writer = new GeoPackageFeatureWriter(output, schema, 2952, "parks - 2952", projection);
		Map<String, Object> first = new LinkedHashMap<>();
		first.put("_id", 1);
		first.put("name", "High Park");
		writer.write(new Feature(first, GeoJsonGeometry.of("MultiPoint",
				Collections.<Object>singletonList(Arrays.asList(300000.0, 4830000.0)))));
		Map<String, Object> second = new LinkedHashMap<>();
		second.put("_id", 2);
		second.put("name", null);
		writer.write(new Feature(second, null));
		writer.close();

		SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + output, true);
		try {
			JdbcTemplate jdbc = new JdbcTemplate(dataSource);
			assertEquals(GeoPackageFeatureWriter.APPLICATION_ID,
					jdbc.queryForObject("PRAGMA application_id", Integer.class).intValue());
			assertEquals("MULTIPOINT", jdbc.queryForObject(
					"SELECT geometry_type_name FROM gpkg_geometry_columns WHERE table_name = ?", String.class, "parks - 2952"));
			assertEquals(Integer.valueOf(2952), jdbc.queryForObject(
					"SELECT srs_id FROM gpkg_contents WHERE table_name = ?", Integer.class, "parks - 2952"));
			assertEquals(Integer.valueOf(1), jdbc.queryForObject(
					"SELECT count(*) FROM gpkg_spatial_ref_sys WHERE srs_id = 2952", Integer.class));

			List<Map<String, Object>> rows = jdbc.queryForList("SELECT * FROM \"parks - 2952\" ORDER BY fid");
			assertEquals(2, rows.size());
			assertEquals("High Park", rows.get(0).get("name"));
			byte[] blob = (byte[]) rows.get(0).get(GeoPackageFeatureWriter.GEOMETRY_COLUMN);
			assertArrayEquals(new byte[]{'G', 'P'}, Arrays.copyOf(blob, 2));
			assertNull(rows.get(1).get(GeoPackageFeatureWriter.GEOMETRY_COLUMN));
			assertNull(rows.get(1).get("name"));

			assertEquals(300000.0, jdbc.queryForObject(
					"SELECT min_x FROM gpkg_contents WHERE table_name = ?", Double.class, "parks - 2952"), 1e-9);
		} finally {
			dataSource.destroy();
		}
	}

	@Test
	void datastoreFieldsNamedLikeReservedColumnsKeepTheirValues() throws Exception {
		ProjectionDefinition projection = TestFixtures.formatConfigLoader(new ObjectMapper())
				.getFormatConfig().projectionFor(4326);
		Map<String, PropertyType> properties = new LinkedHashMap<>();
		properties.put("FID", PropertyType.INT);
		properties.put("geom", PropertyType.STRING);
		Path output = tempDir.resolve("assets - 4326.gpkg");

		GeoPackageFeatureWriter writer = new GeoPackageFeatureWriter(output, new FeatureSchema("MultiPoint", properties),
				4326, "assets - 4326", projection);
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("FID", 7);
		values.put("geom", "hydrant");
		writer.write(new Feature(values, GeoJsonGeometry.of("MultiPoint",
				Collections.<Object>singletonList(Arrays.asList(-79.4, 43.7)))));
		writer.close();

		SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + output, true);
		try {
			JdbcTemplate jdbc = new JdbcTemplate(dataSource);
			assertEquals("geom_1", jdbc.queryForObject(
					"SELECT column_name FROM gpkg_geometry_columns WHERE table_name = ?", String.class, "assets - 4326"));
			Map<String, Object> row = jdbc.queryForMap("SELECT * FROM \"assets - 4326\"");
			assertEquals(7, ((Number) row.get("FID")).intValue());
			assertEquals("hydrant", row.get("geom"));
			assertEquals(1, ((Number) row.get("fid_1")).intValue());
			assertArrayEquals(new byte[]{'G', 'P'}, Arrays.copyOf((byte[]) row.get("geom_1"), 2));
		} finally {
			dataSource.destroy();
		}
	}

	@Test
	void reservedColumnNamesAvoidPropertiesAndEachOther() {
		assertEquals("fid", GeoPackageFeatureWriter.uniqueColumnName("fid", Collections.singleton("name"), null));
		assertEquals("fid_2", GeoPackageFeatureWriter.uniqueColumnName("fid",
				new HashSet<>(Arrays.asList("Fid", "fid_1")), null));
		assertEquals("geom_1", GeoPackageFeatureWriter.uniqueColumnName("geom", Collections.<String>emptySet(), "GEOM"));
	}
}
