package com.silverlakesymmetri.cbs.fileConverter.handler;

import com.silverlakesymmetri.cbs.fileConverter.batch.ConversionStepLauncher;
import com.silverlakesymmetri.cbs.fileConverter.batch.OutputFormatWriter;
import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.slf4j.MDC;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamReader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.silverlakesymmetri.cbs.fileConverter.TestFixtures.record;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_OUTPUT;
import static com.silverlakesymmetri.cbs.fileConverter.TestFixtures.stepLauncher;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChunkedFormatHandlerTest {

	private ConversionStepLauncher launcher;

	@BeforeEach
	void setUp() throws Exception {
		launcher = stepLauncher();
	}

	@SuppressWarnings("unchecked")
	private static ItemStreamReader<DynamicRecord> readerOf(DynamicRecord... records) throws Exception {
		ItemStreamReader<DynamicRecord> reader = mock(ItemStreamReader.class);
		DynamicRecord[] rest = new DynamicRecord[records.length];
		System.arraycopy(records, 1, rest, 0, records.length - 1);
		rest[records.length - 1] = null;
		when(reader.read()).thenReturn(records[0], rest);
		return reader;
	}

	@Test
	void writesInChunksThenCompletesBeforeClosing() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1), record("_id", 2), record("_id", 3));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);
		Path output = Paths.get("out.csv");
		when(writer.getRecordCount()).thenReturn(3L);
		when(writer.complete()).thenReturn(output);

		ChunkedFormatHandler handler = new ChunkedFormatHandler("csv-None", HandlerKind.NON_SPATIAL_CSV, null,
				writer, launcher, 2);

		assertEquals(output, handler.toFile(reader));
		InOrder order = inOrder(reader, writer);
		order.verify(reader).open(any(ExecutionContext.class));
		order.verify(writer).open(any(ExecutionContext.class));
		order.verify(writer, times(2)).write(anyList());
		order.verify(writer).complete();
		order.verify(writer).close();
		verify(reader).close();
	}

	@Test
	void countMismatchFailsBeforeCompletion() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1), record("_id", 2));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);
		when(writer.getRecordCount()).thenReturn(1L);

		ChunkedFormatHandler handler = new ChunkedFormatHandler("json-None", HandlerKind.NON_SPATIAL_JSON, null,
				writer, launcher, 10);

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> handler.toFile(reader));
		assertTrue(e.getMessage().contains("wrote 1 records but read 2"), e.getMessage());
		verify(writer, never()).complete();
		verify(writer).close();
		verify(reader).close();
	}

	@Test
	void processorMayNotDropRecords() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);

		ChunkedFormatHandler handler = new ChunkedFormatHandler("csv-4326", HandlerKind.SPATIAL_CSV,
				item -> null, writer, launcher, 10);

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> handler.toFile(reader));
		assertTrue(e.getMessage().contains("dropped by the processor"), e.getMessage());
		verify(writer, never()).complete();
		verify(reader).close();
	}

	@Test
	void processedRecordsReachTheWriter() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);
		when(writer.getRecordCount()).thenReturn(1L);
		ChunkedFormatHandler handler = new ChunkedFormatHandler("csv-4326", HandlerKind.SPATIAL_CSV, item -> {
			item.addColumn("seen", true);
			return item;
		}, writer, launcher, 10);

		handler.toFile(reader);

		verify(writer).write(ArgumentMatchers.<List<? extends DynamicRecord>>argThat(
				items -> items.size() == 1 && Boolean.TRUE.equals(items.get(0).getValue("seen"))));
	}

	@Test
	void processorErrorSurfacesUnwrapped() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);
		ChunkedFormatHandler handler = new ChunkedFormatHandler("shp-4326", HandlerKind.SPATIAL_SHAPEFILE, item -> {
			throw new SchemaException("bad geometry");
		}, writer, launcher, 10);

		SchemaException e = assertThrows(SchemaException.class, () -> handler.toFile(reader));
		assertEquals("bad geometry", e.getMessage());
		verify(writer, never()).complete();
		verify(writer).close();
	}

	@Test
	void writerOpenFailureSurfaces() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);
		doThrow(new ItemStreamException("scratch directory exists")).when(writer).open(any(ExecutionContext.class));
		ChunkedFormatHandler handler = new ChunkedFormatHandler("shp-2952", HandlerKind.SPATIAL_SHAPEFILE, null,
				writer, launcher, 10);

		assertThrows(ItemStreamException.class, () -> handler.toFile(reader));
		verify(writer, never()).write(anyList());
		verify(writer, never()).complete();
	}

	@Test
	void writerLogsCarryTheHandlerKey() throws Exception {
		ItemStreamReader<DynamicRecord> reader = readerOf(record("_id", 1));
		OutputFormatWriter writer = mock(OutputFormatWriter.class);
		when(writer.getRecordCount()).thenReturn(1L);
		AtomicReference<String> seen = new AtomicReference<>();
		doAnswer(invocation -> {
			seen.set(MDC.get(MDC_OUTPUT));
			return null;
		}).when(writer).write(anyList());
		ChunkedFormatHandler handler = new ChunkedFormatHandler("geojson-2952", HandlerKind.SPATIAL_GENERIC, null,
				writer, launcher, 10);

		handler.toFile(reader);

		assertEquals("geojson-2952", seen.get());
		assertNull(MDC.get(MDC_OUTPUT));
	}
}
