package com.silverlakesymmetri.cbs.fileConverter.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dataset name, ordered field list and the sampled base geometry type, shared read-only
 * by every handler of a request.
 */
public final class DatasetMetadata {

	private final String name;
	private final List<FieldDefinition> fields;
	private final String geometryType;

	public DatasetMetadata(String name, List<FieldDefinition> fields, String geometryType) {
		this.name = name;
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		this.geometryType = geometryType;
	}

	public String getName() {
		return name;
	}

	public List<FieldDefinition> getFields() {
		return fields;
	}

	public List<String> getFieldIds() {
		List<String> ids = new ArrayList<>(fields.size());
		for (FieldDefinition field : fields) {
			ids.add(field.getId());
		}
		return ids;
	}

	public String getGeometryType() {
		return geometryType;
	}
}
