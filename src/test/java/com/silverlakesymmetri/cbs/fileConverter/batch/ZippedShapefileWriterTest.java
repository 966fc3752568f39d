package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.TestFixtures;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import com.silverlakesymmetri.cbs.fileConverter.spatial.ColumnNameMapper;
import com.silverlakesymmetri.cbs.fileConverter.spatial.FeatureSchema;
import com.silverlakesymmetri.cbs.fileConverter.spatial.PropertyType;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialWriterFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.util.StreamUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static com.silverlakesymmetri.cbs.fileConverter.TestFixtures.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZippedShapefileWriterTest {

	private static final List<String> FIELD_IDS = Arrays.asList("_id", "service_request_type", "geometry");

	@TempDir
	Path tempDir;

	private SpatialWriterFactory writerFactory;
	private Map<String, String> columnMap;
	private FeatureSchema schema;

	@BeforeEach
	void setUp() {
		ObjectMapper objectMapper = new ObjectMapper();
		writerFactory = new SpatialWriterFactory(TestFixtures.formatConfigLoader(objectMapper).getFormatConfig(),
				objectMapper);
		columnMap = ColumnNameMapper.mapColumns(FIELD_IDS);
		Map<String, PropertyType> properties = new LinkedHashMap<>();
		properties.put(columnMap.get("_id"), PropertyType.INT);
		properties.put(columnMap.get("service_request_type"), PropertyType.STRING);
		schema = new FeatureSchema("MultiPoint", properties);
	}

	private ZippedShapefileWriter writer(Path shp) {
		return new ZippedShapefileWriter(shp, "requests", FIELD_IDS, schema, columnMap, 4326, writerFactory,
				new FileFinalizationService());
	}

	private static Map<String, byte[]> unzip(Path zip) throws Exception {
		Map<String, byte[]> entries = new HashMap<>();
		try (ZipInputStream in = new ZipInputStream(Files.newInputStream(zip))) {
			ZipEntry entry;
			while ((entry = in.getNextEntry()) != null) {
				entries.put(entry.getName(), StreamUtils.copyToByteArray(in));
			}
		}
		return entries;
	}

	@Test
	void zipContainsShapefileMembersAndFieldMapping() throws Exception {
		Path shp = tempDir.resolve("requests - 4326.shp");
		ZippedShapefileWriter writer = writer(shp);

		writer.open(new ExecutionContext());
		writer.write(Collections.singletonList(record("_id", 1, "service_request_type", "Pothole",
				"geometry", GeoJsonGeometry.of("MultiPoint",
						Collections.<Object>singletonList(Arrays.asList(-79.5, 43.6))))));
		Path zip = writer.complete();
		writer.close();

		assertEquals(tempDir.resolve("requests - 4326.zip"), zip);
		assertFalse(Files.exists(tempDir.resolve("requests - 4326")));
		assertEquals(1, writer.getRecordCount());

		Map<String, byte[]> entries = unzip(zip);
		assertEquals(new TreeSet<>(Arrays.asList("requests - 4326.shp", "requests - 4326.shx",
						"requests - 4326.dbf", "requests - 4326.prj", "requests - 4326.cpg", "requests fields.csv")),
				new TreeSet<>(entries.keySet()));

		String fields = new String(entries.get("requests fields.csv"), StandardCharsets.UTF_8);
		assertEquals("field,name\r\n_id1,_id\r\nservice2,service_request_type\r\n", fields);
	}

	@Test
	void fieldMappingListsEveryNonGeometryField() throws Exception {
		List<String> fieldIds = Arrays.asList("service_system_manager", "agency", "geometry");
		Map<String, String> map = ColumnNameMapper.mapColumns(fieldIds);
		Map<String, PropertyType> properties = new LinkedHashMap<>();
		properties.put(map.get("service_system_manager"), PropertyType.STRING);
		properties.put(map.get("agency"), PropertyType.STRING);
		ZippedShapefileWriter writer = new ZippedShapefileWriter(tempDir.resolve("311 - 4326.shp"), "311", fieldIds,
				new FeatureSchema("MultiPoint", properties), map, 4326, writerFactory, new FileFinalizationService());

		writer.open(new ExecutionContext());
		writer.write(Collections.singletonList(record("service_system_manager", "Transportation", "agency", "311",
				"geometry", GeoJsonGeometry.of("MultiPoint",
						Collections.<Object>singletonList(Arrays.asList(-79.4, 43.7))))));
		Path zip = writer.complete();
		writer.close();

		assertEquals(new TreeSet<>(Arrays.asList("service1", "agency2")), new TreeSet<>(properties.keySet()));
		String fields = new String(unzip(zip).get("311 fields.csv"), StandardCharsets.UTF_8);
		assertEquals("field,name\r\nservice1,service_system_manager\r\nagency2,agency\r\n", fields);
	}

	@Test
	void existingScratchDirectoryIsNotTouched() throws Exception {
		Path scratch = Files.createDirectory(tempDir.resolve("requests - 2952"));
		Path marker = Files.write(scratch.resolve("keep.txt"), "x".getBytes(StandardCharsets.UTF_8));
		ZippedShapefileWriter writer = writer(tempDir.resolve("requests - 2952.shp"));

		assertThrows(ItemStreamException.class, () -> writer.open(new ExecutionContext()));
		writer.close();

		assertTrue(Files.exists(marker));
		assertFalse(Files.exists(tempDir.resolve("requests - 2952.zip")));
	}

	@Test
	void abandonedWriterCleansUp() throws Exception {
		ZippedShapefileWriter writer = writer(tempDir.resolve("requests - 4326.shp"));

		writer.open(new ExecutionContext());
		assertTrue(Files.isDirectory(tempDir.resolve("requests - 4326")));
		writer.close();

		assertFalse(Files.exists(tempDir.resolve("requests - 4326")));
		assertFalse(Files.exists(tempDir.resolve("requests - 4326.zip")));
	}
}
