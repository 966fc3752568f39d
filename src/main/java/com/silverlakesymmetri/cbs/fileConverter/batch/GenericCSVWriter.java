package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import org.beanio.stream.RecordReader;
import org.beanio.stream.RecordWriter;
import org.beanio.stream.csv.CsvRecordParserFactory;

import java.io.BufferedWriter;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV writer built on BeanIO's CSV record stream. The header row is the dataset field list;
 * cells have no size limit and values containing line breaks are quoted.
 */
public class GenericCSVWriter extends AbstractBaseOutputWriter {

	private static final String RECORD_TERMINATOR = "\r\n";

	private final List<String> columns;
	private final RecordValueFormatter formatter;
	private RecordWriter csvWriter;

	public GenericCSVWriter(Path outputPath, List<String> columns, RecordValueFormatter formatter,
							FileFinalizationService fileFinalizationService) {
		super(outputPath, fileFinalizationService);
		this.columns = new ArrayList<>(columns);
		this.formatter = formatter;
	}

	/**
	 * BeanIO CSV writer with the dialect used for every CSV this service produces.
	 */
	public static RecordWriter createCsvWriter(Writer out) {
		return csvFactory().createWriter(out);
	}

	public static RecordReader createCsvReader(Reader in) {
		return csvFactory().createReader(in);
	}

	private static CsvRecordParserFactory csvFactory() {
		CsvRecordParserFactory factory = new CsvRecordParserFactory();
		factory.setDelimiter(',');
		factory.setQuote('"');
		factory.setEscape('"');
		factory.setMultilineEnabled(true);
		factory.setRecordTerminator(RECORD_TERMINATOR);
		factory.init();
		return factory;
	}

	@Override
	protected void openStream(OutputStream os) {
		this.csvWriter = createCsvWriter(new BufferedWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8)));
	}

	@Override
	protected void writeHeader() throws Exception {
		csvWriter.write(columns.toArray(new String[0]));
	}

	@Override
	protected void writeRecord(DynamicRecord record) throws Exception {
		String[] row = new String[columns.size()];
		for (int i = 0; i < row.length; i++) {
			row[i] = formatter.format(record.getValue(columns.get(i)));
		}
		csvWriter.write(row);
	}

	@Override
	protected void flushInternal() throws Exception {
		if (csvWriter != null) csvWriter.flush();
	}

	@Override
	protected void writeFooter() {
		// CSV has no trailer
	}

	@Override
	protected void closeStream() throws Exception {
		if (csvWriter != null) {
			csvWriter.close();
			csvWriter = null;
		}
	}
}
