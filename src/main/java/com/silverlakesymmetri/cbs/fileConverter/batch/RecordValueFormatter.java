package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;

import java.util.Collection;
import java.util.Map;

/**
 * Renders record values as cell or element text for the CSV and XML writers.
 * Structured values (geometries, maps, lists) become compact JSON. Numbers keep the text they
 * have in the JSON output, so {@code 1e-7} is written as {@code 1.0E-7}.
 */
public class RecordValueFormatter {

	private final ObjectMapper objectMapper;

	public RecordValueFormatter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public String format(Object value) {
		if (value == null) {
			return "";
		}
		if (value instanceof String) {
			return (String) value;
		}
		if (value instanceof GeoJsonGeometry || value instanceof Map || value instanceof Collection) {
			try {
				return objectMapper.writeValueAsString(value);
			} catch (JsonProcessingException e) {
				throw new SchemaException("Cannot serialize value " + value, e);
			}
		}
		return value.toString();
	}
}
