package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamWriter;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes records as {@code <DATA><ROW count="n">...</ROW></DATA>} with one child element per field.
 * Output is flushed to disk every {@code chunkSize} rows.
 */
public class GenericXMLWriter extends AbstractBaseOutputWriter {

	static final String ENCODING = "utf-8";
	static final String ROOT_ELEMENT = "DATA";
	static final String ROW_ELEMENT = "ROW";
	static final String COUNT_ATTRIBUTE = "count";

	private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9\\-_]");

	private final RecordValueFormatter formatter;
	private final int chunkSize;
	private final Map<String, String> elementNames = new HashMap<>();
	private XMLStreamWriter xmlWriter;
	private int rowsSinceFlush;

	public GenericXMLWriter(Path outputPath, RecordValueFormatter formatter, int chunkSize,
							FileFinalizationService fileFinalizationService) {
		super(outputPath, fileFinalizationService);
		this.formatter = formatter;
		this.chunkSize = chunkSize;
	}

	@Override
	protected void openStream(OutputStream os) throws Exception {
		this.xmlWriter = XMLOutputFactory.newInstance().createXMLStreamWriter(os, ENCODING);
	}

	@Override
	protected void writeHeader() throws Exception {
		xmlWriter.writeStartDocument(ENCODING, "1.0");
		xmlWriter.writeCharacters("\n");
		xmlWriter.writeStartElement(ROOT_ELEMENT);
	}

	@Override
	protected void writeRecord(DynamicRecord record) throws Exception {
		xmlWriter.writeStartElement(ROW_ELEMENT);
		xmlWriter.writeAttribute(COUNT_ATTRIBUTE, Long.toString(recordCount));
		for (String column : record.getColumnNames()) {
			xmlWriter.writeStartElement(elementName(column));
			xmlWriter.writeCharacters(stripInvalidXmlChars(formatter.format(record.getValue(column))));
			xmlWriter.writeEndElement();
		}
		xmlWriter.writeEndElement();

		if (++rowsSinceFlush >= chunkSize) {
			flushInternal();
			outputStream.flush();
			rowsSinceFlush = 0;
		}
	}

	private String elementName(String column) {
		String name = elementNames.get(column);
		if (name == null) {
			name = sanitizeElementName(column);
			elementNames.put(column, name);
		}
		return name;
	}

	/**
	 * Drops characters outside {@code [A-Za-z0-9_-]}; names that do not start with a letter or
	 * underscore are prefixed with {@code _}.
	 */
	static String sanitizeElementName(String name) {
		String sanitized = INVALID_NAME_CHARS.matcher(name).replaceAll("");
		if (sanitized.isEmpty()) {
			return "_";
		}
		char first = sanitized.charAt(0);
		if (!(Character.isLetter(first) || first == '_')) {
			sanitized = "_" + sanitized;
		}
		return sanitized;
	}

	private static String stripInvalidXmlChars(String text) {
		StringBuilder sb = null;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			boolean valid = c == 0x9 || c == 0xA || c == 0xD || (c >= 0x20 && c != 0xFFFE && c != 0xFFFF);
			if (!valid) {
				if (sb == null) {
					sb = new StringBuilder(text.length());
					sb.append(text, 0, i);
				}
			} else if (sb != null) {
				sb.append(c);
			}
		}
		return sb == null ? text : sb.toString();
	}

	@Override
	protected void flushInternal() throws Exception {
		if (xmlWriter != null) xmlWriter.flush();
	}

	@Override
	protected void writeFooter() throws Exception {
		xmlWriter.writeEndElement();
		xmlWriter.writeEndDocument();
	}

	@Override
	protected void closeStream() throws Exception {
		if (xmlWriter != null) {
			xmlWriter.close();
			xmlWriter = null;
		}
	}
}
