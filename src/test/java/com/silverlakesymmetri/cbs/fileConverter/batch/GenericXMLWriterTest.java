package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.item.ExecutionContext;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.nio.file.Path;
import java.util.Arrays;

import static com.silverlakesymmetri.cbs.fileConverter.TestFixtures.record;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GenericXMLWriterTest {

	@TempDir
	Path tempDir;

	@Test
	void elementNamesAreSanitized() {
		assertEquals("theyear", GenericXMLWriter.sanitizeElementName("the year"));
		assertEquals("_2020", GenericXMLWriter.sanitizeElementName("2020"));
		assertEquals("_id", GenericXMLWriter.sanitizeElementName("_id"));
		assertEquals("ward-name", GenericXMLWriter.sanitizeElementName("ward-name"));
		assertEquals("_", GenericXMLWriter.sanitizeElementName("%%"));
	}

	@Test
	void rowsAreNumberedFromZero() throws Exception {
		Path output = tempDir.resolve("wards.xml");
		GenericXMLWriter writer = new GenericXMLWriter(output, new RecordValueFormatter(new ObjectMapper()), 1,
				new FileFinalizationService());

		writer.open(new ExecutionContext());
		writer.write(Arrays.asList(
				record("_id", 1, "the year", 2020, "ward", "Etobicoke & York"),
				record("_id", 2, "the year", 2021, "ward", null)));
		Path finalPath = writer.complete();
		writer.close();

		Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(finalPath.toFile());
		Element root = document.getDocumentElement();
		assertEquals("DATA", root.getTagName());

		NodeList rows = root.getElementsByTagName("ROW");
		assertEquals(2, rows.getLength());
		Element first = (Element) rows.item(0);
		Element second = (Element) rows.item(1);
		assertEquals("0", first.getAttribute("count"));
		assertEquals("1", second.getAttribute("count"));
		assertEquals("2020", first.getElementsByTagName("theyear").item(0).getTextContent());
		assertEquals("Etobicoke & York", first.getElementsByTagName("ward").item(0).getTextContent());
		assertEquals("", second.getElementsByTagName("ward").item(0).getTextContent());
	}
}
