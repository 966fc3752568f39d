package com.silverlakesymmetri.cbs.fileConverter.source;

import com.silverlakesymmetri.cbs.fileConverter.dto.FieldDefinition;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of a datastore search: the rows plus the field list the datastore reports.
 */
public final class DatastorePage {

	private final List<Map<String, Object>> records;
	private final List<FieldDefinition> fields;

	public DatastorePage(List<Map<String, Object>> records, List<FieldDefinition> fields) {
		this.records = records == null ? Collections.<Map<String, Object>>emptyList() : records;
		this.fields = fields == null ? Collections.<FieldDefinition>emptyList() : fields;
	}

	public List<Map<String, Object>> getRecords() {
		return records;
	}

	public List<FieldDefinition> getFields() {
		return fields;
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}
}
