package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import org.beanio.stream.RecordReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.item.ExecutionContext;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.silverlakesymmetri.cbs.fileConverter.TestFixtures.record;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenericCSVWriterTest {

	@TempDir
	Path tempDir;

	private final RecordValueFormatter formatter = new RecordValueFormatter(new ObjectMapper());

	private List<String[]> readRows(Path csv) throws Exception {
		List<String[]> rows = new ArrayList<>();
		try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
			RecordReader reader = GenericCSVWriter.createCsvReader(in);
			Object row;
			while ((row = reader.read()) != null) {
				rows.add((String[]) row);
			}
			reader.close();
		}
		return rows;
	}

	@Test
	void writesHeaderThenRowsInFieldOrder() throws Exception {
		Path output = tempDir.resolve("calls.csv");
		GenericCSVWriter writer = new GenericCSVWriter(output, Arrays.asList("_id", "name", "score"),
				formatter, new FileFinalizationService());

		writer.open(new ExecutionContext());
		writer.write(Arrays.asList(
				record("_id", 1, "score", 2.5, "name", "Main St"),
				record("_id", 2, "name", null, "score", 10)));
		Path finalPath = writer.complete();
		writer.close();

		assertEquals(output, finalPath);
		assertFalse(Files.exists(FileFinalizationService.partPathFor(output)));
		List<String[]> rows = readRows(output);
		assertEquals(3, rows.size());
		assertArrayEquals(new String[]{"_id", "name", "score"}, rows.get(0));
		assertArrayEquals(new String[]{"1", "Main St", "2.5"}, rows.get(1));
		assertArrayEquals(new String[]{"2", "", "10"}, rows.get(2));
		assertEquals(2, writer.getRecordCount());
	}

	@Test
	void quotedValuesSurviveRoundTrip() throws Exception {
		Path output = tempDir.resolve("notes.csv");
		String note = "line one\nline two, with \"quotes\"";
		GenericCSVWriter writer = new GenericCSVWriter(output, Collections.singletonList("note"),
				formatter, new FileFinalizationService());

		writer.open(new ExecutionContext());
		writer.write(Collections.singletonList(record("note", note)));
		writer.complete();
		writer.close();

		List<String[]> rows = readRows(output);
		assertEquals(2, rows.size());
		assertEquals(note, rows.get(1)[0]);
	}

	@Test
	void geometryValuesAreWrittenAsCompactJson() throws Exception {
		Path output = tempDir.resolve("points.csv");
		GenericCSVWriter writer = new GenericCSVWriter(output, Collections.singletonList("geometry"),
				formatter, new FileFinalizationService());

		writer.open(new ExecutionContext());
		writer.write(Collections.singletonList(record("geometry",
				GeoJsonGeometry.of("MultiPoint",
						Collections.<Object>singletonList(Arrays.asList(1.5, 2.5))))));
		writer.complete();
		writer.close();

		assertEquals("{\"type\":\"MultiPoint\",\"coordinates\":[[1.5,2.5]]}", readRows(output).get(1)[0]);
	}

	@Test
	void abandonedWriterRemovesPartFile() throws Exception {
		Path output = tempDir.resolve("broken.csv");
		GenericCSVWriter writer = new GenericCSVWriter(output, Collections.singletonList("a"),
				formatter, new FileFinalizationService());

		Path partFile = FileFinalizationService.partPathFor(output);

		writer.open(new ExecutionContext());
		writer.write(Collections.singletonList(record("a", "x")));
		assertTrue(Files.exists(partFile));
		writer.close();

		assertFalse(Files.exists(partFile));
		assertFalse(Files.exists(output));
	}
}
