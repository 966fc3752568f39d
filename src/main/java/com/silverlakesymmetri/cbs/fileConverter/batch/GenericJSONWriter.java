package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Writes records as one JSON array. Each serialized record is held back until the next one
 * arrives so the separator is only ever written between elements; the array stays valid for
 * zero, one or many records without buffering the whole output.
 */
public class GenericJSONWriter extends AbstractBaseOutputWriter {

	private static final byte[] ARRAY_START = "[".getBytes(StandardCharsets.UTF_8);
	private static final byte[] SEPARATOR = ",".getBytes(StandardCharsets.UTF_8);
	private static final byte[] ARRAY_END = "]\n".getBytes(StandardCharsets.UTF_8);

	private final ObjectWriter objectWriter;
	private OutputStream out;
	private byte[] pending;

	public GenericJSONWriter(Path outputPath, ObjectMapper objectMapper, FileFinalizationService fileFinalizationService) {
		super(outputPath, fileFinalizationService);
		this.objectWriter = objectMapper.writer();
	}

	@Override
	protected void openStream(OutputStream os) {
		this.out = os;
		this.pending = null;
	}

	@Override
	protected void writeHeader() throws Exception {
		out.write(ARRAY_START);
	}

	@Override
	protected void writeRecord(DynamicRecord record) throws Exception {
		if (pending != null) {
			out.write(pending);
			out.write(SEPARATOR);
		}
		pending = objectWriter.writeValueAsBytes(record.asValueMap());
	}

	@Override
	protected void flushInternal() throws Exception {
		if (out != null) out.flush();
	}

	@Override
	protected void writeFooter() throws Exception {
		if (pending != null) {
			out.write(pending);
			pending = null;
		}
		out.write(ARRAY_END);
	}
}
