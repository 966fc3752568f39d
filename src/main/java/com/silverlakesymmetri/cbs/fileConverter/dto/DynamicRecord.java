package com.silverlakesymmetri.cbs.fileConverter.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One datastore row: an ordered mapping of field name to scalar value. The reserved
 * {@code geometry} field may hold a JSON string, a map, or a parsed geometry.
 */
public class DynamicRecord {

	private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

	public static DynamicRecord fromMap(Map<String, ?> values) {
		DynamicRecord record = new DynamicRecord();
		for (Map.Entry<String, ?> entry : values.entrySet()) {
			record.addColumn(entry.getKey(), entry.getValue());
		}
		return record;
	}

	public void addColumn(String name, Object value) {
		if (name == null) {
			throw new IllegalArgumentException("Column name is required");
		}
		if (values.containsKey(name)) {
			throw new IllegalArgumentException("Duplicate column: " + name);
		}
		values.put(name, value);
	}

	public Object getValue(String name) {
		return values.get(name);
	}

	public boolean hasColumn(String name) {
		return values.containsKey(name);
	}

	public Map<String, Object> asValueMap() {
		return new LinkedHashMap<>(values);
	}

	public Set<String> getColumnNames() {
		return Collections.unmodifiableSet(values.keySet());
	}

	public int size() {
		return values.size();
	}

	public void updateValue(String name, Object newValue) {
		if (!values.containsKey(name)) {
			throw new IllegalArgumentException("Column does not exist: " + name);
		}
		values.put(name, newValue);
	}

	@Override
	public String toString() {
		return "DynamicRecord" + values;
	}
}
