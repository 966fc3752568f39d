package com.silverlakesymmetri.cbs.fileConverter.spatial;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Geometry type (always a Multi type or a collection) and ordered property types of one layer.
 */
public final class FeatureSchema {

	private final String geometryType;
	private final Map<String, PropertyType> properties;

	public FeatureSchema(String geometryType, Map<String, PropertyType> properties) {
		this.geometryType = geometryType;
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
	}

	public String getGeometryType() {
		return geometryType;
	}

	public Map<String, PropertyType> getProperties() {
		return properties;
	}

	public boolean is3D() {
		return geometryType != null && geometryType.startsWith("3D ");
	}
}
